// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.error;

import sh.sigil.core.types.Address;

/**
 * A consulted signature recovered to an untrusted identity, or to an identity
 * not strictly greater than the one before it (duplicate or wrong order).
 * <p>
 * A signature over a stale nonce, a different domain or different action
 * fields recovers to an unrelated identity and therefore also lands here; the
 * cause is deliberately not distinguished.
 *
 * @since 0.1.0
 */
public final class InvalidSignaturesException extends AuthorizationException {

    /** 4-byte selector of {@code InvalidSignatures()}. */
    public static final String SELECTOR = "0x274cf401";

    private final int index;
    private final Address recovered;

    public InvalidSignaturesException(final int index, final Address recovered) {
        super("Invalid signatures: entry " + index + " recovered " + recovered.value());
        this.index = index;
        this.recovered = recovered;
    }

    /**
     * Position of the rejected entry in the submitted list.
     */
    public int index() {
        return index;
    }

    /**
     * Identity the rejected entry recovered to ({@link Address#ZERO} if unrecoverable).
     */
    public Address recovered() {
        return recovered;
    }
}
