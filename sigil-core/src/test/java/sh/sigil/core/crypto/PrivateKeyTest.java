// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.crypto;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import sh.sigil.core.types.Address;

class PrivateKeyTest {

    private static final String ANVIL_KEY_0 =
        "0xac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ff80";
    private static final Address ANVIL_ADDRESS_0 =
        new Address("0xf39Fd6e51aad88F6F4ce6aB8827279cffFb92266");

    private static final BigInteger HALF_ORDER = new BigInteger(
        "7FFFFFFFFFFFFFFFFFFFFFFFFFFFFFFF5D576E7357A4501DDFE92F46681B20A0", 16);

    private static byte[] digest(String text) {
        return Keccak256.hash(text.getBytes(StandardCharsets.UTF_8));
    }

    // ═══════════════════════════════════════════════════════════════
    // Key loading
    // ═══════════════════════════════════════════════════════════════

    @Test
    void fromHex_derivesKnownAddress() {
        assertEquals(ANVIL_ADDRESS_0, PrivateKey.fromHex(ANVIL_KEY_0).toAddress());
    }

    @Test
    void fromHex_acceptsUnprefixedKey() {
        assertEquals(ANVIL_ADDRESS_0, PrivateKey.fromHex(ANVIL_KEY_0.substring(2)).toAddress());
    }

    @Test
    void fromBytes_zeroesInput() {
        byte[] bytes = sh.sigil.primitives.Hex.decode(ANVIL_KEY_0);
        PrivateKey.fromBytes(bytes);
        assertArrayEquals(new byte[32], bytes);
    }

    @Test
    void rejectsInvalidKeys() {
        assertThrows(IllegalArgumentException.class, () -> PrivateKey.fromHex("0x1234"));
        assertThrows(IllegalArgumentException.class, () -> PrivateKey.fromBytes(new byte[32]));
        assertThrows(IllegalArgumentException.class, () -> PrivateKey.fromHex(
            "0xfffffffffffffffffffffffffffffffebaaedce6af48a03bbfd25e8cd0364141"));
    }

    // ═══════════════════════════════════════════════════════════════
    // Signing and recovery
    // ═══════════════════════════════════════════════════════════════

    @Test
    void sign_recoversToSignerAddress() {
        PrivateKey key = PrivateKey.fromHex(ANVIL_KEY_0);
        byte[] hash = digest("approve");

        Signature signature = key.sign(hash);

        assertTrue(signature.v() == 0 || signature.v() == 1);
        assertEquals(ANVIL_ADDRESS_0, PrivateKey.recoverAddress(hash, signature));
        assertEquals(ANVIL_ADDRESS_0, PrivateKey.recoverAddress(hash, signature.withOffsetV()));
    }

    @Test
    void sign_isDeterministic() {
        PrivateKey key = PrivateKey.fromHex(ANVIL_KEY_0);
        byte[] hash = digest("same message");
        assertEquals(key.sign(hash), key.sign(hash));
    }

    @Test
    void sign_producesLowS() {
        PrivateKey key = PrivateKey.fromHex(ANVIL_KEY_0);
        for (int i = 0; i < 16; i++) {
            Signature signature = key.sign(digest("message-" + i));
            assertTrue(new BigInteger(1, signature.s()).compareTo(HALF_ORDER) <= 0, "s must be low for message " + i);
            assertEquals(ANVIL_ADDRESS_0, PrivateKey.recoverAddress(digest("message-" + i), signature));
        }
    }

    @Test
    void sign_rejectsWrongHashLength() {
        PrivateKey key = PrivateKey.fromHex(ANVIL_KEY_0);
        assertThrows(IllegalArgumentException.class, () -> key.sign(new byte[31]));
    }

    @Test
    void recoverAddress_differentHashRecoversOtherAddress() {
        PrivateKey key = PrivateKey.fromHex(ANVIL_KEY_0);
        Signature signature = key.sign(digest("one"));
        assertNotEquals(ANVIL_ADDRESS_0, PrivateKey.recoverAddress(digest("two"), signature));
    }

    @Test
    void recoverAddress_rejectsMalformedSignatures() {
        byte[] hash = digest("x");
        Signature zeroR = new Signature(new byte[32], PrivateKey.fromHex(ANVIL_KEY_0).sign(hash).s(), 27);
        Signature badV = new Signature(new byte[32], new byte[32], 29);

        assertThrows(IllegalArgumentException.class, () -> PrivateKey.recoverAddress(hash, zeroR));
        assertThrows(IllegalArgumentException.class, () -> PrivateKey.recoverAddress(hash, badV));
    }

    // ═══════════════════════════════════════════════════════════════
    // Lifecycle
    // ═══════════════════════════════════════════════════════════════

    @Test
    void destroy_blocksFurtherUse() {
        PrivateKey key = PrivateKey.fromHex(ANVIL_KEY_0);
        key.destroy();

        assertTrue(key.isDestroyed());
        assertThrows(IllegalStateException.class, key::toAddress);
        assertThrows(IllegalStateException.class, () -> key.sign(new byte[32]));
        assertEquals("PrivateKey[destroyed]", key.toString());
    }

    @Test
    void toString_neverShowsKeyMaterial() {
        String text = PrivateKey.fromHex(ANVIL_KEY_0).toString();
        assertFalse(text.contains("ac0974"));
        assertTrue(text.contains(ANVIL_ADDRESS_0.value()));
    }
}
