// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.error;

/**
 * Base runtime exception for all Sigil failures.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * SigilException
 * ├── {@link Eip712Exception} - typed-data encoding failures
 * └── {@link AuthorizationException} - aborted multisig transactions
 *     ├── {@link InvalidSignaturesException} - untrusted or mis-ordered signer
 *     ├── {@link MissingSignaturesException} - fewer signatures than the quorum
 *     └── {@link ExecutionFailedException} - the forwarded call failed
 * </pre>
 *
 * <pre>{@code
 * try {
 *     wallet.execute(target, value, payload, signatures);
 * } catch (InvalidSignaturesException e) {
 *     // re-collect or re-sort signatures over the current nonce
 * } catch (ExecutionFailedException e) {
 *     // the target rejected the call; nothing was applied
 * } catch (SigilException e) {
 *     // any other Sigil error
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class SigilException extends RuntimeException
        permits Eip712Exception,
        AuthorizationException {

    public SigilException(final String message) {
        super(message);
    }

    public SigilException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
