// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.multisig;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class NonceSequencerTest {

    @Test
    void startsAtOne() {
        assertEquals(1, new NonceSequencer().current());
    }

    @Test
    void advance_returnsConsumedValue() {
        NonceSequencer nonces = new NonceSequencer();

        assertEquals(1, nonces.advance());
        assertEquals(2, nonces.advance());
        assertEquals(3, nonces.current());
    }

    @Test
    void restore_rewindsToSnapshot() {
        NonceSequencer nonces = new NonceSequencer(10);
        long snapshot = nonces.snapshot();
        nonces.advance();

        nonces.restore(snapshot);

        assertEquals(10, nonces.current());
    }

    @Test
    void overflow_throws() {
        NonceSequencer nonces = new NonceSequencer(Long.MAX_VALUE);

        assertThrows(ArithmeticException.class, nonces::advance);
        assertEquals(Long.MAX_VALUE, nonces.current());
    }

    @Test
    void negativeStart_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new NonceSequencer(-1));
    }
}
