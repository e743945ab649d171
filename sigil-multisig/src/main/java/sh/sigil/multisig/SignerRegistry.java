// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.multisig;

import java.util.Collection;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

import org.jspecify.annotations.Nullable;

import sh.sigil.core.types.Address;

/**
 * Membership set of trusted signers.
 *
 * <p>Answers membership only. To list the current set, fold the wallet's
 * {@link MultisigEvent.SignerUpdated} history with
 * {@link sh.sigil.multisig.client.SignerSetReplay}.
 *
 * <p>Not thread-safe; guarded by the owning {@link MultisigWallet}.
 */
public final class SignerRegistry {

    private final Set<Address> trusted = new HashSet<>();

    public SignerRegistry() {
    }

    public SignerRegistry(final Collection<Address> initial) {
        Objects.requireNonNull(initial, "initial");
        for (Address signer : initial) {
            trusted.add(Objects.requireNonNull(signer, "signer"));
        }
    }

    public boolean isTrusted(final @Nullable Address signer) {
        return signer != null && trusted.contains(signer);
    }

    /**
     * Sets the membership of {@code signer}.
     *
     * @return true if the membership changed
     */
    public boolean setTrust(final Address signer, final boolean shouldTrust) {
        Objects.requireNonNull(signer, "signer");
        return shouldTrust ? trusted.add(signer) : trusted.remove(signer);
    }

    Set<Address> snapshot() {
        return Set.copyOf(trusted);
    }

    void restore(final Set<Address> snapshot) {
        trusted.clear();
        trusted.addAll(snapshot);
    }
}
