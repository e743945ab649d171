// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.multisig;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import sh.sigil.core.types.Address;

class SignerRegistryTest {

    private static final Address A = new Address("0x00000000000000000000000000000000000000aa");
    private static final Address B = new Address("0x00000000000000000000000000000000000000bb");

    @Test
    void setTrust_reportsMembershipChange() {
        SignerRegistry registry = new SignerRegistry();

        assertTrue(registry.setTrust(A, true));
        assertFalse(registry.setTrust(A, true));
        assertTrue(registry.isTrusted(A));
        assertTrue(registry.setTrust(A, false));
        assertFalse(registry.setTrust(A, false));
        assertFalse(registry.isTrusted(A));
    }

    @Test
    void isTrusted_nullIsNeverTrusted() {
        assertFalse(new SignerRegistry(List.of(A)).isTrusted(null));
    }

    @Test
    void restore_replacesMembership() {
        SignerRegistry registry = new SignerRegistry(List.of(A));
        Set<Address> snapshot = registry.snapshot();
        registry.setTrust(A, false);
        registry.setTrust(B, true);

        registry.restore(snapshot);

        assertTrue(registry.isTrusted(A));
        assertFalse(registry.isTrusted(B));
    }
}
