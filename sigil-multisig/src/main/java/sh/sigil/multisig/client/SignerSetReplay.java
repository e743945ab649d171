// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.multisig.client;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import sh.sigil.core.types.Address;
import sh.sigil.multisig.MultisigEvent;
import sh.sigil.multisig.MultisigEventListener;

/**
 * Tracks the trusted signer set from {@link MultisigEvent.SignerUpdated} events.
 *
 * <p>The wallet answers membership queries only; an indexer that needs the
 * full set starts from the configured signers and folds the event history,
 * either live as a listener or offline with {@link #replay}.
 */
public final class SignerSetReplay implements MultisigEventListener {

    private final Set<Address> trusted;

    public SignerSetReplay(final Collection<Address> initial) {
        this.trusted = new LinkedHashSet<>(Objects.requireNonNull(initial, "initial"));
    }

    /**
     * Folds {@code events} over {@code initial}; events other than signer updates are ignored.
     */
    public static Set<Address> replay(
            final Collection<Address> initial, final Iterable<? extends MultisigEvent> events) {
        Objects.requireNonNull(events, "events");
        final SignerSetReplay replay = new SignerSetReplay(initial);
        for (MultisigEvent event : events) {
            replay.onEvent(event);
        }
        return replay.trusted();
    }

    @Override
    public synchronized void onEvent(final MultisigEvent event) {
        if (event instanceof MultisigEvent.SignerUpdated update) {
            if (update.shouldTrust()) {
                trusted.add(update.signer());
            } else {
                trusted.remove(update.signer());
            }
        }
    }

    /**
     * A snapshot of the currently trusted signers.
     */
    public synchronized Set<Address> trusted() {
        return Set.copyOf(trusted);
    }
}
