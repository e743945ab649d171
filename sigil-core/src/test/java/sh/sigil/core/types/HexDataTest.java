// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.types;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class HexDataTest {

    @Test
    void emptyConstant() {
        assertEquals("0x", HexData.EMPTY.value());
        assertEquals(0, HexData.EMPTY.byteLength());
        assertSame(HexData.EMPTY, HexData.fromBytes(new byte[0]));
    }

    @Test
    void normalizesToLowercase() {
        HexData data = new HexData("0xABCDEF");
        assertEquals("0xabcdef", data.value());
        assertEquals(new HexData("0xabcdef"), data);
        assertEquals(new HexData("0xabcdef").hashCode(), data.hashCode());
    }

    @Test
    void rejectsOddLengthAndMissingPrefix() {
        assertThrows(IllegalArgumentException.class, () -> new HexData("0x123"));
        assertThrows(IllegalArgumentException.class, () -> new HexData("1234"));
        assertThrows(IllegalArgumentException.class, () -> new HexData("0xzz"));
    }

    @Test
    void fromBytes_copiesInput() {
        byte[] bytes = {0x01, 0x02};
        HexData data = HexData.fromBytes(bytes);
        bytes[0] = 0x7f;
        assertEquals("0x0102", data.value());
    }

    @Test
    void toBytes_returnsCopy() {
        HexData data = new HexData("0x0102");
        byte[] first = data.toBytes();
        first[0] = 0x7f;
        assertArrayEquals(new byte[] {0x01, 0x02}, data.toBytes());
        assertEquals(2, data.byteLength());
    }
}
