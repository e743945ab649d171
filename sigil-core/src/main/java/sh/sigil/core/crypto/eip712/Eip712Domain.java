// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.crypto.eip712;

import org.jspecify.annotations.Nullable;

import sh.sigil.core.types.Address;
import sh.sigil.core.types.Hash;

/**
 * The signing context a digest is bound to.
 *
 * <p>Only the members that are set take part in the separator, so a domain
 * without a {@code verifyingContract} hashes as
 * {@code EIP712Domain(string name,string version,uint256 chainId)}.
 * Wallets always set all four.
 *
 * @param name the protocol name, or null
 * @param version the signing domain version, or null
 * @param chainId the EIP-155 chain ID, or null
 * @param verifyingContract the wallet address, or null
 * @see <a href="https://eips.ethereum.org/EIPS/eip-712">EIP-712</a>
 */
public record Eip712Domain(
        @Nullable String name,
        @Nullable String version,
        @Nullable Long chainId,
        @Nullable Address verifyingContract
) {

    public static Builder builder() {
        return new Builder();
    }

    /**
     * {@code hashStruct(EIP712Domain)} over the members that are set.
     */
    public Hash separator() {
        return StructHasher.hashDomain(this);
    }

    public static final class Builder {
        private String name;
        private String version;
        private Long chainId;
        private Address verifyingContract;

        Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder chainId(long chainId) {
            this.chainId = chainId;
            return this;
        }

        public Builder verifyingContract(Address verifyingContract) {
            this.verifyingContract = verifyingContract;
            return this;
        }

        public Eip712Domain build() {
            return new Eip712Domain(name, version, chainId, verifyingContract);
        }
    }
}
