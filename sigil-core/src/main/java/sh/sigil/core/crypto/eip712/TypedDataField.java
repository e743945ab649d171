// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.crypto.eip712;

import java.util.Objects;

/**
 * One struct member, as it appears in the canonical type string:
 * {@code uint256 nonce} is {@code TypedDataField.of("nonce", "uint256")}.
 *
 * @param name the member name
 * @param type the Solidity member type
 */
public record TypedDataField(String name, String type) {

    public TypedDataField {
        if (Objects.requireNonNull(name, "name").isBlank() || Objects.requireNonNull(type, "type").isBlank()) {
            throw new IllegalArgumentException("Struct member needs a name and a type: " + type + " " + name);
        }
    }

    public static TypedDataField of(String name, String type) {
        return new TypedDataField(name, type);
    }
}
