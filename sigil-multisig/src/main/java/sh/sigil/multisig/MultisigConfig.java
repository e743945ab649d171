// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.multisig;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import sh.sigil.core.crypto.eip712.Eip712Domain;
import sh.sigil.core.types.Address;

/**
 * Construction parameters of a {@link MultisigWallet}.
 *
 * <p>The signing domain is derived from {@code name}, {@code version},
 * {@code chainId} and the wallet's own {@code address}; none of them can change
 * after construction.
 *
 * <pre>{@code
 * MultisigConfig config = MultisigConfig.builder()
 *     .name("Treasury")
 *     .chainId(1L)
 *     .address(walletAddress)
 *     .signers(List.of(alice, bob, carol))
 *     .quorum(2)
 *     .build();
 * }</pre>
 *
 * @param name    wallet name, non-blank
 * @param version domain version, default {@value DigestBuilder#DOMAIN_VERSION}
 * @param chainId chain identifier, positive, default 1
 * @param address the wallet's own address (the domain's verifying contract)
 * @param signers initial trusted signers; duplicates collapse
 * @param quorum  initial threshold, non-negative
 */
public record MultisigConfig(
        String name,
        String version,
        long chainId,
        Address address,
        Set<Address> signers,
        long quorum
) {

    public static final long DEFAULT_CHAIN_ID = 1L;

    public MultisigConfig {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(signers, "signers");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (version.isBlank()) {
            throw new IllegalArgumentException("version must not be blank");
        }
        if (chainId <= 0) {
            throw new IllegalArgumentException("chainId must be positive, got " + chainId);
        }
        QuorumPolicy.of(quorum);
        signers = Set.copyOf(signers);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The signing domain for this wallet.
     */
    public Eip712Domain domain() {
        return Eip712Domain.builder()
            .name(name)
            .version(version)
            .chainId(chainId)
            .verifyingContract(address)
            .build();
    }

    public static final class Builder {
        private String name;
        private String version = DigestBuilder.DOMAIN_VERSION;
        private long chainId = DEFAULT_CHAIN_ID;
        private Address address;
        private final Set<Address> signers = new LinkedHashSet<>();
        private long quorum;

        Builder() {}

        public Builder name(final String name) {
            this.name = name;
            return this;
        }

        public Builder version(final String version) {
            this.version = version;
            return this;
        }

        public Builder chainId(final long chainId) {
            this.chainId = chainId;
            return this;
        }

        public Builder address(final Address address) {
            this.address = address;
            return this;
        }

        public Builder signer(final Address signer) {
            this.signers.add(Objects.requireNonNull(signer, "signer"));
            return this;
        }

        public Builder signers(final Collection<Address> signers) {
            Objects.requireNonNull(signers, "signers");
            signers.forEach(this::signer);
            return this;
        }

        public Builder quorum(final long quorum) {
            this.quorum = quorum;
            return this;
        }

        public MultisigConfig build() {
            return new MultisigConfig(name, version, chainId, address, signers, quorum);
        }
    }
}
