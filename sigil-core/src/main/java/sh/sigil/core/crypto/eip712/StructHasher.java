// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.crypto.eip712;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import sh.sigil.core.crypto.Keccak256;
import sh.sigil.core.error.Eip712Exception;
import sh.sigil.core.types.Hash;

/**
 * {@code hashStruct} for flat structs, plus the domain separator.
 *
 * <p>A flat struct has no struct-typed members, so its canonical type string
 * is just {@code Name(type1 name1,type2 name2,...)} with no appended
 * dependencies.
 */
final class StructHasher {

    static final String DOMAIN_TYPE = "EIP712Domain";

    private StructHasher() {}

    static String encodeType(final String name, final List<TypedDataField> fields) {
        return fields.stream()
            .map(field -> field.type() + " " + field.name())
            .collect(Collectors.joining(",", name + "(", ")"));
    }

    static byte[] typeHash(final String name, final List<TypedDataField> fields) {
        return Keccak256.hash(encodeType(name, fields).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * {@code keccak256(typeHash || enc(field_1) || ... || enc(field_n))}.
     *
     * @throws Eip712Exception if a field is missing or does not fit its type
     */
    static byte[] hashStruct(final String name, final List<TypedDataField> fields, final Map<String, Object> values) {
        final byte[][] words = new byte[fields.size() + 1][];
        words[0] = typeHash(name, fields);
        for (int i = 0; i < fields.size(); i++) {
            final TypedDataField field = fields.get(i);
            final Object value = values.get(field.name());
            if (value == null) {
                throw Eip712Exception.missingField(name, field.name());
            }
            words[i + 1] = FieldCodec.forType(field.type()).encode(field.type(), value);
        }
        return Keccak256.hash(words);
    }

    /**
     * The {@code EIP712Domain} members present on {@code domain}, in canonical order.
     */
    static List<TypedDataField> domainFields(final Eip712Domain domain) {
        final List<TypedDataField> fields = new ArrayList<>(4);
        if (domain.name() != null) fields.add(TypedDataField.of("name", "string"));
        if (domain.version() != null) fields.add(TypedDataField.of("version", "string"));
        if (domain.chainId() != null) fields.add(TypedDataField.of("chainId", "uint256"));
        if (domain.verifyingContract() != null) fields.add(TypedDataField.of("verifyingContract", "address"));
        return List.copyOf(fields);
    }

    static Hash hashDomain(final Eip712Domain domain) {
        final Map<String, Object> values = new HashMap<>();
        if (domain.name() != null) values.put("name", domain.name());
        if (domain.version() != null) values.put("version", domain.version());
        if (domain.chainId() != null) values.put("chainId", domain.chainId());
        if (domain.verifyingContract() != null) values.put("verifyingContract", domain.verifyingContract());
        return Hash.fromBytes(hashStruct(DOMAIN_TYPE, domainFields(domain), values));
    }
}
