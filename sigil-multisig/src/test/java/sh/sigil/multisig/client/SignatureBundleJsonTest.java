// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.multisig.client;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import sh.sigil.core.crypto.Signature;
import sh.sigil.core.types.Hash;
import sh.sigil.multisig.MultisigFixtures;
import sh.sigil.primitives.Hex;

class SignatureBundleJsonTest {

    private static final Hash DIGEST =
        new Hash("0x948d83e69d75ce4b4f229180c8fbb395207b0474c7f73042a109424b0aa35611");

    @Test
    void toJson_writesHexComponents() {
        Signature signature = MultisigFixtures.signer(0).signHash(DIGEST);
        String json = SignatureBundleJson.toJson(new SignatureBundle("Execute", 4, List.of(signature)));

        assertTrue(json.contains("\"primaryType\":\"Execute\""));
        assertTrue(json.contains("\"nonce\":4"));
        assertTrue(json.contains("\"r\":\"" + Hex.encode(signature.r()) + "\""));
        assertTrue(json.contains("\"v\":" + signature.v()));
    }

    @Test
    void parse_restoresSignaturesInOrder() {
        List<Signature> signatures = List.of(
            MultisigFixtures.signer(4).signHash(DIGEST),
            MultisigFixtures.signer(2).signHash(DIGEST));
        SignatureBundle bundle = new SignatureBundle("UpdateSigner", 12, signatures);

        SignatureBundle parsed = SignatureBundleJson.parse(SignatureBundleJson.toJson(bundle));

        assertEquals(bundle, parsed);
    }

    @Test
    void parse_rejectsMalformedDocuments() {
        assertThrows(IllegalArgumentException.class, () -> SignatureBundleJson.parse("not json"));
        assertThrows(IllegalArgumentException.class, () -> SignatureBundleJson.parse("[]"));
        assertThrows(IllegalArgumentException.class,
            () -> SignatureBundleJson.parse("{\"primaryType\":\"Execute\",\"signatures\":[]}"));
        assertThrows(IllegalArgumentException.class,
            () -> SignatureBundleJson.parse("{\"primaryType\":\"Execute\",\"nonce\":1,"
                + "\"signatures\":[{\"r\":\"0x01\",\"s\":\"0x02\",\"v\":27}]}"));
    }

    @Test
    void parse_rejectsNegativeNonce() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
            () -> SignatureBundleJson.parse("{\"primaryType\":\"Execute\",\"nonce\":-1,\"signatures\":[]}"));
        assertTrue(ex.getMessage().contains("nonce"));
    }
}
