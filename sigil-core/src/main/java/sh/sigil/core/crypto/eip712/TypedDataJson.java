// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.crypto.eip712;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import sh.sigil.core.error.Eip712Exception;
import sh.sigil.core.types.Address;
import sh.sigil.core.types.HexData;
import sh.sigil.core.types.Wei;
import sh.sigil.primitives.Hex;

/**
 * JSON support for EIP-712 typed data in the {@code eth_signTypedData_v4}
 * format used by browser and hardware wallets.
 *
 * <pre>{@code
 * // Coordinator renders the request for an external wallet
 * String json = TypedDataJson.toJson(typedData);
 *
 * // Signer side recomputes the digest from the request itself
 * TypedData<?> received = TypedDataJson.parseAndValidate(json);
 * Signature sig = received.sign(signer);
 * }</pre>
 *
 * <p>Integers are written as decimal strings so 256-bit values survive
 * JavaScript number parsing.
 *
 * @since 0.1.0
 */
public final class TypedDataJson {
    private static final ObjectMapper MAPPER = createMapper();

    private TypedDataJson() {}

    /**
     * Parses EIP-712 typed data from a JSON string.
     *
     * @param json the JSON string in eth_signTypedData_v4 format
     * @return parsed typed data payload
     * @throws Eip712Exception if the JSON is invalid or missing required fields
     */
    public static TypedDataPayload parse(String json) {
        Objects.requireNonNull(json, "json");
        final JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new Eip712Exception("Invalid EIP-712 JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new Eip712Exception("EIP-712 JSON must be an object");
        }

        var domain = parseDomain(required(root, "domain"));
        var primaryType = required(root, "primaryType").asText();
        var fields = parseFields(required(root, "types"), primaryType);
        var message = required(root, "message");
        if (!message.isObject()) {
            throw Eip712Exception.invalidValue(primaryType, message);
        }

        var messageData = new LinkedHashMap<String, Object>();
        message.fields().forEachRemaining(e -> messageData.put(e.getKey(), toJava(e.getValue())));
        return new TypedDataPayload(domain, primaryType, fields, messageData);
    }

    /**
     * Parses and validates typed data, then creates a signable TypedData instance.
     * The struct hash is computed eagerly so malformed messages fail here.
     *
     * @param json the JSON string in eth_signTypedData_v4 format
     * @return validated TypedData ready for signing or hashing
     * @throws Eip712Exception if the JSON is invalid or the message does not match its types
     */
    public static TypedData<Map<String, Object>> parseAndValidate(String json) {
        var typedData = TypedData.fromPayload(parse(json));
        TypedData.hashStruct(typedData.definition(), typedData.message());
        return typedData;
    }

    /**
     * Renders typed data as an {@code eth_signTypedData_v4} JSON request.
     *
     * @param typedData the typed data
     * @return the JSON document
     */
    public static String toJson(TypedData<?> typedData) {
        Objects.requireNonNull(typedData, "typedData");
        var root = MAPPER.createObjectNode();

        var types = root.putObject("types");
        writeFields(types.putArray(StructHasher.DOMAIN_TYPE), StructHasher.domainFields(typedData.domain()));
        writeFields(types.putArray(typedData.primaryType()), typedData.definition().fields());

        root.put("primaryType", typedData.primaryType());
        writeDomain(root.putObject("domain"), typedData.domain());
        root.set("message", toNode(typedData.messageData()));

        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new Eip712Exception("Failed to render EIP-712 JSON", e);
        }
    }

    static ObjectMapper mapper() {
        return MAPPER;
    }

    private static JsonNode required(JsonNode node, String field) {
        var value = node.get(field);
        if (value == null || value.isNull()) {
            throw Eip712Exception.missingField("TypedData", field);
        }
        return value;
    }

    private static Eip712Domain parseDomain(JsonNode node) {
        if (!node.isObject()) {
            throw Eip712Exception.invalidValue(StructHasher.DOMAIN_TYPE, node);
        }
        var builder = Eip712Domain.builder();
        try {
            if (node.hasNonNull("name")) builder.name(node.get("name").asText());
            if (node.hasNonNull("version")) builder.version(node.get("version").asText());
            if (node.hasNonNull("chainId")) builder.chainId(parseChainId(node.get("chainId")));
            if (node.hasNonNull("verifyingContract")) {
                builder.verifyingContract(new Address(node.get("verifyingContract").asText()));
            }
        } catch (IllegalArgumentException e) {
            throw new Eip712Exception("Invalid EIP-712 domain: " + e.getMessage(), e);
        }
        return builder.build();
    }

    private static long parseChainId(JsonNode node) {
        if (node.isIntegralNumber()) {
            return node.longValue();
        }
        var text = node.asText();
        return Hex.hasPrefix(text) ? Long.parseLong(Hex.cleanPrefix(text), 16) : Long.parseLong(text);
    }

    /**
     * Reads the member list of {@code primaryType}. Other entries, including
     * {@code EIP712Domain}, are not consulted: the domain members follow from
     * the domain object itself.
     */
    private static List<TypedDataField> parseFields(JsonNode types, String primaryType) {
        if (!types.isObject()) {
            throw Eip712Exception.invalidValue("types", types);
        }
        var declared = types.get(primaryType);
        if (declared == null || !declared.isArray()) {
            throw Eip712Exception.unknownType(primaryType);
        }
        var fields = new ArrayList<TypedDataField>();
        for (JsonNode field : declared) {
            fields.add(new TypedDataField(
                required(field, "name").asText(),
                required(field, "type").asText()));
        }
        return fields;
    }

    private static Object toJava(JsonNode node) {
        if (node.isBoolean()) {
            return node.booleanValue();
        } else if (node.isIntegralNumber()) {
            return node.bigIntegerValue();
        } else if (node.isTextual()) {
            return node.textValue();
        } else if (node.isNull()) {
            return null;
        }
        // structs, arrays and fractional numbers have no member type here
        throw Eip712Exception.invalidValue("message value", node);
    }

    private static void writeFields(ArrayNode array, List<TypedDataField> fields) {
        for (var field : fields) {
            array.addObject().put("name", field.name()).put("type", field.type());
        }
    }

    private static void writeDomain(ObjectNode node, Eip712Domain domain) {
        if (domain.name() != null) node.put("name", domain.name());
        if (domain.version() != null) node.put("version", domain.version());
        if (domain.chainId() != null) node.put("chainId", domain.chainId());
        if (domain.verifyingContract() != null) node.put("verifyingContract", domain.verifyingContract().value());
    }

    private static JsonNode toNode(Map<String, Object> message) {
        var node = MAPPER.createObjectNode();
        message.forEach((name, value) -> {
            if (value instanceof Boolean b) {
                node.put(name, b);
            } else if (value instanceof BigInteger || value instanceof Long || value instanceof Integer) {
                node.put(name, value.toString());
            } else if (value instanceof Wei wei) {
                node.put(name, wei.value().toString());
            } else if (value instanceof Address address) {
                node.put(name, address.value());
            } else if (value instanceof HexData data) {
                node.put(name, data.value());
            } else if (value instanceof byte[] bytes) {
                node.put(name, Hex.encode(bytes));
            } else if (value instanceof String s) {
                node.put(name, s);
            } else {
                throw Eip712Exception.invalidValue(name, value);
            }
        });
        return node;
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
}
