// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.multisig.client;

import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;

import sh.sigil.core.crypto.eip712.Eip712Domain;
import sh.sigil.core.crypto.eip712.TypeDefinition;
import sh.sigil.core.crypto.eip712.TypedData;
import sh.sigil.core.crypto.eip712.TypedDataJson;
import sh.sigil.core.error.Eip712Exception;
import sh.sigil.core.types.Address;
import sh.sigil.core.types.HexData;
import sh.sigil.core.types.Wei;
import sh.sigil.multisig.Execute;
import sh.sigil.multisig.MultisigAction;
import sh.sigil.multisig.UpdateQuorum;
import sh.sigil.multisig.UpdateSigner;
import sh.sigil.primitives.Hex;

/**
 * Converts wallet actions to and from {@code eth_signTypedData_v4} JSON requests,
 * so approvals can be gathered from external wallets.
 */
public final class SignatureRequests {

    private SignatureRequests() {}

    /**
     * Renders the typed-data request for {@code action} at {@code nonce}.
     */
    public static String toJson(final Eip712Domain domain, final MultisigAction action, final long nonce) {
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(action, "action");
        return TypedDataJson.toJson(action.typedData(domain, nonce));
    }

    /**
     * Decodes a typed-data request back into a wallet action.
     *
     * <p>The request's struct definition must be exactly the wallet's
     * definition for its primary type; anything else would hash to a digest
     * the wallet never accepts.
     *
     * @param json the request document
     * @return the decoded request
     * @throws Eip712Exception if the document is malformed or not a wallet action
     */
    public static SignatureRequest parse(final String json) {
        final TypedData<Map<String, Object>> typedData = TypedDataJson.parseAndValidate(json);
        final String primaryType = typedData.primaryType();
        final Map<String, Object> message = typedData.message();
        final MultisigAction action;
        if (Execute.PRIMARY_TYPE.equals(primaryType)) {
            requireDefinition(typedData.definition(), Execute.DEFINITION);
            action = new Execute(
                address(message, primaryType, "target"),
                wei(message, primaryType, "value"),
                hexData(message, primaryType, "payload"));
        } else if (UpdateQuorum.PRIMARY_TYPE.equals(primaryType)) {
            requireDefinition(typedData.definition(), UpdateQuorum.DEFINITION);
            action = new UpdateQuorum(toLong(uint(message, primaryType, "newQuorum"), primaryType, "newQuorum"));
        } else if (UpdateSigner.PRIMARY_TYPE.equals(primaryType)) {
            requireDefinition(typedData.definition(), UpdateSigner.DEFINITION);
            action = new UpdateSigner(
                address(message, primaryType, "signer"),
                bool(message, primaryType, "shouldTrust"));
        } else {
            throw Eip712Exception.unknownType(primaryType);
        }
        final long nonce = toLong(uint(message, primaryType, "nonce"), primaryType, "nonce");
        return new SignatureRequest(typedData.domain(), action, nonce);
    }

    private static void requireDefinition(final TypeDefinition<?> actual, final TypeDefinition<?> expected) {
        if (!expected.fields().equals(actual.fields())) {
            throw new Eip712Exception("Unexpected struct definition for " + expected.primaryType()
                + ": " + actual.encodeType());
        }
    }

    private static Object field(final Map<String, Object> message, final String type, final String name) {
        final Object value = message.get(name);
        if (value == null) {
            throw Eip712Exception.missingField(type, name);
        }
        return value;
    }

    private static String text(final Map<String, Object> message, final String type, final String name) {
        return field(message, type, name).toString();
    }

    private static Address address(final Map<String, Object> message, final String type, final String name) {
        try {
            return new Address(text(message, type, name));
        } catch (IllegalArgumentException e) {
            throw new Eip712Exception("Invalid address for " + type + "." + name, e);
        }
    }

    private static Wei wei(final Map<String, Object> message, final String type, final String name) {
        try {
            return Wei.of(uint(message, type, name));
        } catch (IllegalArgumentException e) {
            throw new Eip712Exception("Invalid value for " + type + "." + name, e);
        }
    }

    private static HexData hexData(final Map<String, Object> message, final String type, final String name) {
        try {
            return new HexData(text(message, type, name));
        } catch (IllegalArgumentException e) {
            throw new Eip712Exception("Invalid bytes for " + type + "." + name, e);
        }
    }

    private static boolean bool(final Map<String, Object> message, final String type, final String name) {
        final Object value = field(message, type, name);
        if (value instanceof Boolean b) {
            return b;
        }
        throw Eip712Exception.invalidValue("bool", value);
    }

    private static BigInteger uint(final Map<String, Object> message, final String type, final String name) {
        final Object value = field(message, type, name);
        if (value instanceof BigInteger bi) {
            return bi;
        }
        final String s = value.toString();
        try {
            return Hex.hasPrefix(s) ? new BigInteger(Hex.cleanPrefix(s), 16) : new BigInteger(s);
        } catch (NumberFormatException e) {
            throw new Eip712Exception("Invalid uint256 for " + type + "." + name + ": " + s, e);
        }
    }

    private static long toLong(final BigInteger value, final String type, final String name) {
        if (value.signum() < 0 || value.bitLength() > 63) {
            throw new Eip712Exception("Value out of range for " + type + "." + name + ": " + value);
        }
        return value.longValue();
    }
}
