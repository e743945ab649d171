// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.error;

/**
 * A multisig transaction was aborted.
 * <p>
 * Whenever one of these is thrown out of a wallet entry point, no state was
 * changed: the nonce, quorum, signer set and balance are exactly as before the
 * call and no event was published.
 *
 * @since 0.1.0
 */
public abstract sealed class AuthorizationException extends SigilException
        permits InvalidSignaturesException,
        MissingSignaturesException,
        ExecutionFailedException {

    protected AuthorizationException(final String message) {
        super(message);
    }

    protected AuthorizationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
