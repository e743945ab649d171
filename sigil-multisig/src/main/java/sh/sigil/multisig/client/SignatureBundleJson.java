// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.multisig.client;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import sh.sigil.core.crypto.Signature;
import sh.sigil.primitives.Hex;

/**
 * JSON exchange format for {@link SignatureBundle}s:
 *
 * <pre>{@code
 * {
 *   "primaryType": "Execute",
 *   "nonce": 1,
 *   "signatures": [ { "r": "0x...", "s": "0x...", "v": 27 } ]
 * }
 * }</pre>
 */
public final class SignatureBundleJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SignatureBundleJson() {}

    public static String toJson(final SignatureBundle bundle) {
        Objects.requireNonNull(bundle, "bundle");
        final ObjectNode root = MAPPER.createObjectNode();
        root.put("primaryType", bundle.primaryType());
        root.put("nonce", bundle.nonce());
        final ArrayNode signatures = root.putArray("signatures");
        for (Signature signature : bundle.signatures()) {
            signatures.addObject()
                .put("r", Hex.encode(signature.r()))
                .put("s", Hex.encode(signature.s()))
                .put("v", signature.v());
        }
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render signature bundle", e);
        }
    }

    /**
     * @throws IllegalArgumentException if the document is not a well-formed bundle
     */
    public static SignatureBundle parse(final String json) {
        Objects.requireNonNull(json, "json");
        final JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid signature bundle JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Signature bundle must be a JSON object");
        }
        final JsonNode nonce = required(root, "nonce");
        if (!nonce.canConvertToExactIntegral() || !nonce.canConvertToLong()) {
            throw new IllegalArgumentException("nonce must be an integer, got " + nonce);
        }
        if (nonce.longValue() < 0) {
            throw new IllegalArgumentException("nonce must be non-negative, got " + nonce);
        }
        final JsonNode array = required(root, "signatures");
        if (!array.isArray()) {
            throw new IllegalArgumentException("signatures must be an array");
        }
        final List<Signature> signatures = new ArrayList<>(array.size());
        for (JsonNode node : array) {
            final JsonNode v = required(node, "v");
            if (!v.isInt()) {
                throw new IllegalArgumentException("v must be an integer, got " + v);
            }
            signatures.add(new Signature(
                Hex.decode(required(node, "r").asText()),
                Hex.decode(required(node, "s").asText()),
                v.intValue()));
        }
        return new SignatureBundle(required(root, "primaryType").asText(), nonce.longValue(), signatures);
    }

    private static JsonNode required(final JsonNode node, final String field) {
        final JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Missing field: " + field);
        }
        return value;
    }
}
