// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.crypto.eip712;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import sh.sigil.core.error.Eip712Exception;
import sh.sigil.core.types.Address;
import sh.sigil.core.types.Hash;
import sh.sigil.core.types.HexData;

class TypedDataJsonTest {

    private static final String APPROVAL_JSON = """
        {
            "types": {
                "EIP712Domain": [
                    {"name": "name", "type": "string"},
                    {"name": "version", "type": "string"},
                    {"name": "chainId", "type": "uint256"},
                    {"name": "verifyingContract", "type": "address"}
                ],
                "Approval": [
                    {"name": "wallet", "type": "address"},
                    {"name": "nonce", "type": "uint256"},
                    {"name": "payload", "type": "bytes"},
                    {"name": "reason", "type": "string"},
                    {"name": "granted", "type": "bool"}
                ]
            },
            "primaryType": "Approval",
            "domain": {
                "name": "Sigil",
                "version": "1",
                "chainId": 1,
                "verifyingContract": "0x5FbDB2315678afecb367f032d93F642f64180aa3"
            },
            "message": {
                "wallet": "0x5FbDB2315678afecb367f032d93F642f64180aa3",
                "nonce": 42,
                "payload": "0xdeadbeef",
                "reason": "rotate keys",
                "granted": true
            }
        }
        """;

    // ═══════════════════════════════════════════════════════════════
    // parse()
    // ═══════════════════════════════════════════════════════════════

    @Test
    void parse_approvalJson_returnsPayload() {
        TypedDataPayload payload = TypedDataJson.parse(APPROVAL_JSON);

        assertEquals("Approval", payload.primaryType());
        assertEquals("Sigil", payload.domain().name());
        assertEquals(1L, payload.domain().chainId());
        assertEquals(new Address("0x5fbdb2315678afecb367f032d93f642f64180aa3"), payload.domain().verifyingContract());
        assertEquals(5, payload.fields().size());
        assertEquals(TypedDataField.of("granted", "bool"), payload.fields().get(4));
        assertEquals(BigInteger.valueOf(42), payload.message().get("nonce"));
    }

    @Test
    void parseAndValidate_approvalJson_hashesToKnownDigest() {
        var typedData = TypedDataJson.parseAndValidate(APPROVAL_JSON);
        assertEquals(new Hash("0xe710afae219e5abdb803f141f19b6c570d6528e015fce626231ab919217bcba6"),
            typedData.hash());
    }

    @Test
    void parse_hexChainId() {
        String json = APPROVAL_JSON.replace("\"chainId\": 1", "\"chainId\": \"0x1\"");
        assertEquals(1L, TypedDataJson.parse(json).domain().chainId());
    }

    @Test
    void parse_malformedJson_throws() {
        assertThrows(Eip712Exception.class, () -> TypedDataJson.parse("{not json"));
        assertThrows(Eip712Exception.class, () -> TypedDataJson.parse("[]"));
    }

    @Test
    void parse_missingPrimaryType_throws() {
        String json = APPROVAL_JSON.replace("\"primaryType\": \"Approval\",", "");
        Eip712Exception ex = assertThrows(Eip712Exception.class, () -> TypedDataJson.parse(json));
        assertTrue(ex.getMessage().contains("primaryType"));
    }

    @Test
    void parse_primaryTypeNotInTypes_throws() {
        String json = APPROVAL_JSON.replace("\"primaryType\": \"Approval\"", "\"primaryType\": \"Consent\"");
        assertThrows(Eip712Exception.class, () -> TypedDataJson.parse(json));
    }

    @Test
    void parseAndValidate_badFieldValue_throws() {
        String json = APPROVAL_JSON.replace("\"payload\": \"0xdeadbeef\"", "\"payload\": \"0xabc\"");
        assertThrows(Eip712Exception.class, () -> TypedDataJson.parseAndValidate(json));
    }

    @Test
    void parse_invalidDomainAddress_throws() {
        String json = APPROVAL_JSON.replace("\"verifyingContract\": \"0x5FbDB2315678afecb367f032d93F642f64180aa3\"", "\"verifyingContract\": \"0xabc\"");
        assertThrows(Eip712Exception.class, () -> TypedDataJson.parse(json));
    }

    // ═══════════════════════════════════════════════════════════════
    // toJson()
    // ═══════════════════════════════════════════════════════════════

    @Test
    void toJson_writesV4RequestShape() throws Exception {
        var fields = List.of(
            TypedDataField.of("to", "address"),
            TypedDataField.of("amount", "uint256"),
            TypedDataField.of("memo", "bytes"));
        var message = new LinkedHashMap<String, Object>();
        message.put("to", new Address("0x00000000000000000000000000000000000000aa"));
        message.put("amount", new BigInteger("115792089237316195423570985008687907853269984665640564039457584007913129639935"));
        message.put("memo", new HexData("0xdeadbeef"));
        var domain = Eip712Domain.builder().name("Vault").version("1").chainId(10L).build();
        var typedData = TypedData.create(domain, TypeDefinition.forMap("Transfer", fields), message);

        JsonNode root = TypedDataJson.mapper().readTree(TypedDataJson.toJson(typedData));

        assertEquals("Transfer", root.get("primaryType").asText());
        assertEquals(3, root.get("types").get("EIP712Domain").size());
        assertEquals(3, root.get("types").get("Transfer").size());
        assertEquals(10, root.get("domain").get("chainId").asInt());
        assertFalse(root.get("domain").has("verifyingContract"));
        assertEquals("0x00000000000000000000000000000000000000aa", root.get("message").get("to").asText());
        assertTrue(root.get("message").get("amount").isTextual());
        assertEquals("0xdeadbeef", root.get("message").get("memo").asText());
    }

    @Test
    void toJson_thenParse_preservesDigest() {
        var original = TypedDataJson.parseAndValidate(APPROVAL_JSON);
        var reparsed = TypedDataJson.parseAndValidate(TypedDataJson.toJson(original));
        assertEquals(original.hash(), reparsed.hash());
    }

    @Test
    void parse_nestedMessageValue_throws() {
        String json = APPROVAL_JSON.replace("\"reason\": \"rotate keys\"", "\"reason\": {\"text\": \"rotate keys\"}");
        assertThrows(Eip712Exception.class, () -> TypedDataJson.parse(json));
    }

    @Test
    void parseAndValidate_structMemberType_throws() {
        String json = APPROVAL_JSON.replace("{\"name\": \"reason\", \"type\": \"string\"}",
            "{\"name\": \"reason\", \"type\": \"Reason\"}");
        assertThrows(Eip712Exception.class, () -> TypedDataJson.parseAndValidate(json));
    }
}
