// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.crypto.eip712;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A typed-data request as read from {@code eth_signTypedData_v4} JSON,
 * before any value has been checked against its field type.
 *
 * @param domain the signing domain
 * @param primaryType the struct name
 * @param fields the struct members, in declaration order
 * @param message member values keyed by name
 */
public record TypedDataPayload(
        Eip712Domain domain,
        String primaryType,
        List<TypedDataField> fields,
        Map<String, Object> message
) {
    public TypedDataPayload {
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(primaryType, "primaryType");
        Objects.requireNonNull(message, "message");
        fields = List.copyOf(fields);
    }
}
