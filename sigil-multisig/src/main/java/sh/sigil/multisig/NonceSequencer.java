// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.multisig;

import java.math.BigInteger;

/**
 * The wallet's single replay counter, shared by every action kind.
 *
 * <p>{@link #current()} is the nonce the next action must be signed over. A
 * successful action consumes it via {@link #advance()}; a failed one is rolled
 * back through {@link #restore(long)}, so a nonce is only ever spent by an
 * applied action.
 *
 * <p>Not thread-safe; guarded by the owning {@link MultisigWallet}.
 */
public final class NonceSequencer {

    /** First nonce of a new wallet. */
    public static final long INITIAL = 1L;

    private long next;

    public NonceSequencer() {
        this(INITIAL);
    }

    public NonceSequencer(final long start) {
        toUint(start);
        this.next = start;
    }

    public long current() {
        return next;
    }

    /**
     * Consumes the current nonce.
     *
     * @return the nonce that was current before the call
     * @throws ArithmeticException if the counter would overflow
     */
    public long advance() {
        final long consumed = next;
        next = Math.addExact(next, 1L);
        return consumed;
    }

    long snapshot() {
        return next;
    }

    void restore(final long snapshot) {
        this.next = snapshot;
    }

    static BigInteger toUint(final long nonce) {
        if (nonce < 0) {
            throw new IllegalArgumentException("nonce must be non-negative, got " + nonce);
        }
        return BigInteger.valueOf(nonce);
    }
}
