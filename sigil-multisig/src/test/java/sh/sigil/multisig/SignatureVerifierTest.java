// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.multisig;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import sh.sigil.core.crypto.Signature;
import sh.sigil.core.error.InvalidSignaturesException;
import sh.sigil.core.error.MissingSignaturesException;
import sh.sigil.core.types.Address;
import sh.sigil.core.types.Hash;

@ExtendWith(MockitoExtension.class)
class SignatureVerifierTest {

    private static final Hash DIGEST =
        new Hash("0x1111111111111111111111111111111111111111111111111111111111111111");

    private static final Address A = new Address("0x1000000000000000000000000000000000000001");
    private static final Address B = new Address("0x2000000000000000000000000000000000000002");
    private static final Address C = new Address("0x8000000000000000000000000000000000000003");

    private static final Signature SIG_A = signature(1);
    private static final Signature SIG_B = signature(2);
    private static final Signature SIG_C = signature(3);

    @Mock
    private SignerRecovery recovery;

    private SignatureVerifier verifier;
    private SignerRegistry registry;

    private static Signature signature(int tag) {
        byte[] r = new byte[32];
        r[31] = (byte) tag;
        byte[] s = new byte[32];
        s[31] = (byte) tag;
        return new Signature(r, s, 27);
    }

    @BeforeEach
    void setUp() {
        verifier = new SignatureVerifier(recovery);
        registry = new SignerRegistry(List.of(A, B, C));
    }

    @Test
    void ascendingTrustedSigners_returnsRecovered() {
        when(recovery.recover(DIGEST, SIG_A)).thenReturn(A);
        when(recovery.recover(DIGEST, SIG_B)).thenReturn(B);
        when(recovery.recover(DIGEST, SIG_C)).thenReturn(C);

        assertEquals(List.of(A, B, C), verifier.verify(DIGEST, List.of(SIG_A, SIG_B, SIG_C), 3, registry));
    }

    @Test
    void onlyQuorumEntriesAreInspected() {
        when(recovery.recover(DIGEST, SIG_A)).thenReturn(A);

        assertEquals(List.of(A), verifier.verify(DIGEST, List.of(SIG_A, SIG_C, SIG_B), 1, registry));
        verify(recovery, never()).recover(DIGEST, SIG_C);
    }

    @Test
    void zeroQuorum_inspectsNothing() {
        assertEquals(List.of(), verifier.verify(DIGEST, List.of(), 0, registry));
        verify(recovery, never()).recover(any(), any());
    }

    @Test
    void equalNeighbours_rejected() {
        when(recovery.recover(DIGEST, SIG_A)).thenReturn(A);
        when(recovery.recover(DIGEST, SIG_B)).thenReturn(A);

        InvalidSignaturesException ex = assertThrows(InvalidSignaturesException.class,
            () -> verifier.verify(DIGEST, List.of(SIG_A, SIG_B), 2, registry));
        assertEquals(1, ex.index());
        assertEquals(A, ex.recovered());
    }

    @Test
    void descendingNeighbours_rejected() {
        when(recovery.recover(DIGEST, SIG_C)).thenReturn(C);
        when(recovery.recover(DIGEST, SIG_A)).thenReturn(A);

        assertThrows(InvalidSignaturesException.class,
            () -> verifier.verify(DIGEST, List.of(SIG_C, SIG_A), 2, registry));
    }

    @Test
    void untrusted_rejected() {
        when(recovery.recover(DIGEST, SIG_A)).thenReturn(A);
        registry.setTrust(A, false);

        InvalidSignaturesException ex = assertThrows(InvalidSignaturesException.class,
            () -> verifier.verify(DIGEST, List.of(SIG_A), 1, registry));
        assertEquals(0, ex.index());
    }

    @Test
    void unrecoverable_failsAgainstZeroSentinel() {
        when(recovery.recover(DIGEST, SIG_A)).thenReturn(Address.ZERO);
        registry.setTrust(Address.ZERO, true);

        assertThrows(InvalidSignaturesException.class,
            () -> verifier.verify(DIGEST, List.of(SIG_A), 1, registry));
    }

    @Test
    void shortList_checksEarlierEntriesFirst() {
        when(recovery.recover(DIGEST, SIG_A)).thenReturn(A);

        MissingSignaturesException ex = assertThrows(MissingSignaturesException.class,
            () -> verifier.verify(DIGEST, List.of(SIG_A), 2, registry));
        assertEquals(2, ex.required());
        assertEquals(1, ex.supplied());
    }

    @Test
    void shortListWithInvalidEntry_reportsInvalid() {
        when(recovery.recover(DIGEST, SIG_B)).thenReturn(B);
        when(recovery.recover(DIGEST, SIG_A)).thenReturn(A);

        assertThrows(InvalidSignaturesException.class,
            () -> verifier.verify(DIGEST, List.of(SIG_B, SIG_A), 3, registry));
    }
}
