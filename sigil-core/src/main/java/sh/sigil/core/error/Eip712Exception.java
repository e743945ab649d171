// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.error;

/**
 * A typed-data message could not be hashed or decoded: the struct uses a
 * member type outside {@code address}, {@code bool}, {@code bytes},
 * {@code string} and {@code uintN}, a member is missing, or a value does not
 * fit its type.
 *
 * @since 0.1.0
 */
public final class Eip712Exception extends SigilException {

    public Eip712Exception(final String message) {
        super(message);
    }

    public Eip712Exception(final String message, final Throwable cause) {
        super(message, cause);
    }

    public static Eip712Exception unknownType(final String type) {
        return new Eip712Exception("Unknown EIP-712 type: " + type);
    }

    public static Eip712Exception missingField(final String typeName, final String fieldName) {
        return new Eip712Exception("Missing field '" + fieldName + "' in type '" + typeName + "'");
    }

    public static Eip712Exception invalidValue(final String type, final Object value) {
        return new Eip712Exception("Invalid value for type '" + type + "': " + value);
    }

    /**
     * @param reason why the value does not fit, e.g. {@code "negative"}
     */
    public static Eip712Exception valueOutOfRange(final String type, final Object value, final String reason) {
        return new Eip712Exception("Value out of range for '" + type + "': " + value + " (" + reason + ")");
    }
}
