// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.multisig;

import java.util.Objects;

import sh.sigil.core.crypto.eip712.Eip712Domain;
import sh.sigil.core.crypto.eip712.TypedData;
import sh.sigil.core.types.Address;
import sh.sigil.core.types.Hash;

/**
 * Builds the digest signers approve for an action.
 *
 * <p>{@code digest = keccak256(0x19 0x01 || domainSeparator || hashStruct(action, nonce))}.
 * Any wallet implementing {@code eth_signTypedData_v4} reproduces it from
 * {@link MultisigAction#typedData(Eip712Domain, long)}.
 *
 * <pre>{@code
 * Hash separator = DigestBuilder.domain("Treasury", 1L, walletAddress).separator();
 * Hash digest = DigestBuilder.buildDigest(separator, new UpdateQuorum(3), 1L);
 * }</pre>
 */
public final class DigestBuilder {

    /** Domain version every wallet signs under. */
    public static final String DOMAIN_VERSION = "1";

    private DigestBuilder() {
    }

    /**
     * The signing domain {@code EIP712Domain(string name,string version,uint256 chainId,address verifyingContract)}.
     *
     * @param name              wallet name
     * @param chainId           chain identifier
     * @param verifyingContract the wallet's own address
     * @return the domain with version {@value #DOMAIN_VERSION}
     */
    public static Eip712Domain domain(final String name, final long chainId, final Address verifyingContract) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(verifyingContract, "verifyingContract");
        return Eip712Domain.builder()
            .name(name)
            .version(DOMAIN_VERSION)
            .chainId(chainId)
            .verifyingContract(verifyingContract)
            .build();
    }

    /**
     * @param domainSeparator the wallet's domain separator
     * @param action          the action being approved
     * @param nonce           the nonce the approval is bound to
     * @return the 32-byte digest
     */
    public static Hash buildDigest(final Hash domainSeparator, final MultisigAction action, final long nonce) {
        Objects.requireNonNull(domainSeparator, "domainSeparator");
        Objects.requireNonNull(action, "action");
        return TypedData.digest(domainSeparator, action.structHash(nonce));
    }
}
