// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.crypto.eip712;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

import sh.sigil.core.crypto.Keccak256;
import sh.sigil.core.error.Eip712Exception;
import sh.sigil.core.types.Address;
import sh.sigil.core.types.HexData;
import sh.sigil.core.types.Wei;
import sh.sigil.primitives.Hex;

/**
 * Encodes one struct member into its 32-byte {@code encodeData} word.
 *
 * <p>Only the member types that appear in authorization messages are
 * supported: {@code address}, {@code bool}, {@code bytes}, {@code string}
 * and {@code uint8} through {@code uint256}. Dynamic values are hashed;
 * everything else is left-padded.
 */
enum FieldCodec {

    ADDRESS {
        @Override
        byte[] encode(final String type, final Object value) {
            final Address address;
            if (value instanceof Address a) {
                address = a;
            } else if (value instanceof String s) {
                try {
                    address = new Address(s);
                } catch (IllegalArgumentException e) {
                    throw Eip712Exception.invalidValue(type, value);
                }
            } else {
                throw Eip712Exception.invalidValue(type, value);
            }
            return word(address.toBytes());
        }
    },

    BOOL {
        @Override
        byte[] encode(final String type, final Object value) {
            if (!(value instanceof Boolean flag)) {
                throw Eip712Exception.invalidValue(type, value);
            }
            final byte[] out = new byte[WORD];
            out[WORD - 1] = (byte) (flag ? 1 : 0);
            return out;
        }
    },

    BYTES {
        @Override
        byte[] encode(final String type, final Object value) {
            final byte[] raw;
            if (value instanceof HexData data) {
                raw = data.toBytes();
            } else if (value instanceof byte[] bytes) {
                raw = bytes;
            } else if (value instanceof String s && Hex.hasPrefix(s)) {
                try {
                    raw = Hex.decode(s);
                } catch (IllegalArgumentException e) {
                    throw Eip712Exception.invalidValue(type, value);
                }
            } else {
                throw Eip712Exception.invalidValue(type, value);
            }
            return Keccak256.hash(raw);
        }
    },

    STRING {
        @Override
        byte[] encode(final String type, final Object value) {
            if (!(value instanceof String s)) {
                throw Eip712Exception.invalidValue(type, value);
            }
            return Keccak256.hash(s.getBytes(StandardCharsets.UTF_8));
        }
    },

    UINT {
        @Override
        byte[] encode(final String type, final Object value) {
            final BigInteger n = toBigInteger(type, value);
            final int bits = Integer.parseInt(type.substring(4));
            if (n.signum() < 0) {
                throw Eip712Exception.valueOutOfRange(type, value, "negative");
            }
            if (n.bitLength() > bits) {
                throw Eip712Exception.valueOutOfRange(type, value, "exceeds " + bits + " bits");
            }
            final byte[] magnitude = n.toByteArray();
            // toByteArray may carry a leading sign byte
            if (magnitude.length > WORD) {
                final byte[] trimmed = new byte[WORD];
                System.arraycopy(magnitude, magnitude.length - WORD, trimmed, 0, WORD);
                return trimmed;
            }
            return word(magnitude);
        }
    };

    static final int WORD = 32;

    /**
     * Encodes {@code value} as a member of Solidity type {@code type}.
     *
     * @throws Eip712Exception if the value does not fit the type
     */
    abstract byte[] encode(String type, Object value);

    /**
     * Resolves the codec for a member type.
     *
     * @throws Eip712Exception if the type is not supported
     */
    static FieldCodec forType(final String type) {
        switch (type) {
            case "address":
                return ADDRESS;
            case "bool":
                return BOOL;
            case "bytes":
                return BYTES;
            case "string":
                return STRING;
            default:
                if (isUintWidth(type)) {
                    return UINT;
                }
                throw Eip712Exception.unknownType(type);
        }
    }

    private static boolean isUintWidth(final String type) {
        if (!type.startsWith("uint") || type.length() == 4 || type.length() > 7) {
            return false;
        }
        final String digits = type.substring(4);
        if (!digits.chars().allMatch(Character::isDigit) || digits.startsWith("0")) {
            return false;
        }
        final int bits = Integer.parseInt(digits);
        return bits <= 256 && bits % 8 == 0;
    }

    private static BigInteger toBigInteger(final String type, final Object value) {
        if (value instanceof BigInteger bi) {
            return bi;
        } else if (value instanceof Wei wei) {
            return wei.value();
        } else if (value instanceof Long || value instanceof Integer) {
            return BigInteger.valueOf(((Number) value).longValue());
        } else if (value instanceof String s) {
            try {
                return Hex.hasPrefix(s) ? new BigInteger(Hex.cleanPrefix(s), 16) : new BigInteger(s);
            } catch (NumberFormatException e) {
                throw Eip712Exception.invalidValue(type, value);
            }
        }
        throw Eip712Exception.invalidValue(type, value);
    }

    private static byte[] word(final byte[] value) {
        final byte[] out = new byte[WORD];
        System.arraycopy(value, 0, out, WORD - value.length, value.length);
        return out;
    }
}
