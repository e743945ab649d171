// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.multisig;

import java.util.Objects;
import java.util.Set;

import org.jspecify.annotations.Nullable;

import sh.sigil.core.types.Address;
import sh.sigil.core.types.Wei;

/**
 * Mutable state of one wallet: signer set, quorum, nonce and balance.
 *
 * <p>Mutators are package-private; all changes go through {@link MultisigWallet},
 * which snapshots the state before each transaction and restores it on failure.
 */
public final class MultisigState {

    private final SignerRegistry signers;
    private final NonceSequencer nonces;
    private QuorumPolicy quorum;
    private Wei balance = Wei.ZERO;

    /**
     * Point-in-time copy used to roll back a failed transaction.
     */
    record Snapshot(Set<Address> signers, long quorum, long nonce, Wei balance) {}

    MultisigState(final SignerRegistry signers, final QuorumPolicy quorum, final NonceSequencer nonces) {
        this.signers = Objects.requireNonNull(signers, "signers");
        this.quorum = Objects.requireNonNull(quorum, "quorum");
        this.nonces = Objects.requireNonNull(nonces, "nonces");
    }

    public boolean isTrusted(final @Nullable Address signer) {
        return signers.isTrusted(signer);
    }

    public long quorum() {
        return quorum.required();
    }

    public long nonce() {
        return nonces.current();
    }

    public Wei balance() {
        return balance;
    }

    SignerRegistry signers() {
        return signers;
    }

    NonceSequencer nonces() {
        return nonces;
    }

    void setQuorum(final QuorumPolicy quorum) {
        this.quorum = Objects.requireNonNull(quorum, "quorum");
    }

    void credit(final Wei amount) {
        this.balance = balance.plus(amount);
    }

    void debit(final Wei amount) {
        this.balance = balance.minus(amount);
    }

    Snapshot snapshot() {
        return new Snapshot(signers.snapshot(), quorum.required(), nonces.snapshot(), balance);
    }

    void restore(final Snapshot snapshot) {
        signers.restore(snapshot.signers());
        quorum = QuorumPolicy.of(snapshot.quorum());
        nonces.restore(snapshot.nonce());
        balance = snapshot.balance();
    }
}
