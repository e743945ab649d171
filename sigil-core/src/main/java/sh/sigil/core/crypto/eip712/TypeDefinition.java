// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.crypto.eip712;

import java.lang.reflect.RecordComponent;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

import sh.sigil.core.types.Hash;

/**
 * Binds a struct name and its member list to a Java message type.
 *
 * <pre>{@code
 * record Message(BigInteger newQuorum, BigInteger nonce) {}
 *
 * static final TypeDefinition<Message> DEFINITION = TypeDefinition.forRecord(
 *     Message.class,
 *     "UpdateQuorum",
 *     List.of(
 *         TypedDataField.of("newQuorum", "uint256"),
 *         TypedDataField.of("nonce", "uint256")));
 * }</pre>
 *
 * <p>Member types are resolved when the definition is built, so an
 * unsupported type fails at class initialization rather than at signing time.
 *
 * @param <T> the message type
 * @param primaryType the struct name
 * @param fields the struct members, in declaration order
 * @param extractor reads member values from a message
 */
public record TypeDefinition<T>(
    String primaryType,
    List<TypedDataField> fields,
    Function<T, Map<String, Object>> extractor
) {
    public TypeDefinition {
        Objects.requireNonNull(primaryType, "primaryType");
        Objects.requireNonNull(extractor, "extractor");
        if (primaryType.isBlank()) {
            throw new IllegalArgumentException("primaryType cannot be blank");
        }
        fields = List.copyOf(fields);
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("struct " + primaryType + " has no fields");
        }
        for (TypedDataField field : fields) {
            FieldCodec.forType(field.type());
        }
    }

    /**
     * A definition whose messages are already name-to-value maps.
     */
    public static TypeDefinition<Map<String, Object>> forMap(String primaryType, List<TypedDataField> fields) {
        return new TypeDefinition<>(primaryType, fields, Function.identity());
    }

    /**
     * A definition over a record whose components are exactly the struct
     * members, in the same order.
     *
     * @throws IllegalArgumentException if {@code recordClass} is not a record
     *         or its components do not line up with {@code fields}
     */
    public static <T extends Record> TypeDefinition<T> forRecord(
            Class<T> recordClass,
            String primaryType,
            List<TypedDataField> fields) {
        Objects.requireNonNull(recordClass, "recordClass");
        if (!recordClass.isRecord()) {
            throw new IllegalArgumentException("Class must be a record: " + recordClass.getName());
        }
        RecordComponent[] components = recordClass.getRecordComponents();
        List<String> names = fields.stream().map(TypedDataField::name).toList();
        List<String> componentNames = Arrays.stream(components).map(RecordComponent::getName).toList();
        if (!names.equals(componentNames)) {
            throw new IllegalArgumentException(
                recordClass.getSimpleName() + " components " + componentNames + " do not match fields " + names);
        }

        Function<T, Map<String, Object>> extractor = record -> {
            var result = new LinkedHashMap<String, Object>();
            for (RecordComponent component : components) {
                try {
                    result.put(component.getName(), component.getAccessor().invoke(record));
                } catch (ReflectiveOperationException e) {
                    throw new IllegalStateException(
                        "Failed to extract field '" + component.getName() + "' from " + recordClass.getName(), e);
                }
            }
            return result;
        };
        return new TypeDefinition<>(primaryType, fields, extractor);
    }

    /**
     * Canonical type string, e.g. {@code "UpdateQuorum(uint256 newQuorum,uint256 nonce)"}.
     */
    public String encodeType() {
        return StructHasher.encodeType(primaryType, fields);
    }

    public Hash typeHash() {
        return Hash.fromBytes(StructHasher.typeHash(primaryType, fields));
    }
}
