// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.multisig;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.sigil.core.DebugLogger;
import sh.sigil.core.crypto.Signature;
import sh.sigil.core.crypto.eip712.Eip712Domain;
import sh.sigil.core.error.AuthorizationException;
import sh.sigil.core.types.Address;
import sh.sigil.core.types.Hash;
import sh.sigil.core.types.HexData;
import sh.sigil.core.types.Wei;

/**
 * A multi-signature wallet: a trusted signer set approves actions by signing
 * EIP-712 digests off-platform, and the wallet verifies them before applying
 * the action.
 *
 * <h2>Authorization</h2>
 * <p>
 * For every action the wallet consumes the current nonce, builds the digest
 * with {@link DigestBuilder}, and requires the first {@link #quorum()}
 * signatures to recover to trusted signers in strictly ascending address
 * order. Signatures must therefore be collected over {@link #nonce()} as it
 * stands when the action is submitted, and sorted by signer address
 * ({@link sh.sigil.multisig.client.SignatureCollector} does both).
 *
 * <h2>Atomicity</h2>
 * <p>
 * Every entry point runs as one transaction. If anything fails (bad
 * signatures, a failed call, an exception from a collaborator) the nonce,
 * quorum, signer set and balance are restored and no event is published.
 * Events reach listeners only once the outermost transaction commits.
 *
 * <h2>Thread Safety</h2>
 * <p>
 * All public methods synchronize on the wallet, so submissions are fully
 * serialized. The lock is reentrant: a {@link TargetInvoker} or listener may
 * call back into the same wallet, and such a nested call observes the nonce
 * its enclosing action already consumed. Of two submissions signed over the
 * same nonce, the second always fails verification.
 *
 * <pre>{@code
 * var wallet = MultisigWallet.create(config, router);
 * var action = new UpdateQuorum(3);
 * List<Signature> signatures = new SignatureCollector(wallet.domain())
 *     .collect(action, wallet.nonce(), signers);
 * wallet.setQuorum(3, signatures);
 * }</pre>
 */
public final class MultisigWallet {

    private static final Logger log = LoggerFactory.getLogger(MultisigWallet.class);

    private final Address address;
    private final Eip712Domain domain;
    private final Hash domainSeparator;
    private final SignatureVerifier verifier;
    private final Executor executor;
    private final MultisigState state;

    private final List<MultisigEvent> pendingEvents = new ArrayList<>();
    private final List<MultisigEventListener> listeners = new CopyOnWriteArrayList<>();
    private int depth;

    public MultisigWallet(final MultisigConfig config, final SignerRecovery recovery, final TargetInvoker invoker) {
        Objects.requireNonNull(config, "config");
        this.address = config.address();
        this.domain = config.domain();
        this.domainSeparator = domain.separator();
        this.verifier = new SignatureVerifier(recovery);
        this.executor = new Executor(invoker);
        this.state = new MultisigState(
            new SignerRegistry(config.signers()),
            QuorumPolicy.of(config.quorum()),
            new NonceSequencer());
        log.debug("Created wallet {} with {} signers, quorum {}, domain separator {}",
            address.value(), config.signers().size(), config.quorum(), domainSeparator.value());
    }

    /**
     * Creates a wallet that recovers signers with secp256k1 ECDSA.
     */
    public static MultisigWallet create(final MultisigConfig config, final TargetInvoker invoker) {
        return new MultisigWallet(config, EcdsaSignerRecovery.INSTANCE, invoker);
    }

    // ═══════════════════════════════════════════════════════════════
    // Authorized actions
    // ═══════════════════════════════════════════════════════════════

    /**
     * Calls {@code target} with {@code value} and {@code payload}; emits {@link MultisigEvent.Executed}.
     *
     * @return data returned by the target
     * @throws sh.sigil.core.error.InvalidSignaturesException if verification fails
     * @throws sh.sigil.core.error.MissingSignaturesException if fewer than {@link #quorum()} signatures are supplied
     * @throws sh.sigil.core.error.ExecutionFailedException if the call fails
     */
    public synchronized HexData execute(
            final Address target, final Wei value, final HexData payload, final List<Signature> signatures) {
        return submit(new Execute(target, value, payload), signatures);
    }

    /**
     * Replaces the quorum; emits {@link MultisigEvent.QuorumUpdated}. The change
     * itself must satisfy the quorum in force before it.
     */
    public synchronized void setQuorum(final long newQuorum, final List<Signature> signatures) {
        submit(new UpdateQuorum(newQuorum), signatures);
    }

    /**
     * Adds or removes a trusted signer; emits {@link MultisigEvent.SignerUpdated}.
     */
    public synchronized void setSigner(final Address signer, final boolean shouldTrust, final List<Signature> signatures) {
        submit(new UpdateSigner(signer, shouldTrust), signatures);
    }

    /**
     * Authorizes and applies any action.
     *
     * @return the target's return data for {@link Execute}, otherwise {@link HexData#EMPTY}
     */
    public synchronized HexData submit(final MultisigAction action, final List<Signature> signatures) {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(signatures, "signatures");
        return transact(() -> {
            final long nonce = authorize(action, signatures);
            final HexData result = apply(action);
            DebugLogger.logExecution("[COMMIT] wallet=%s action=%s nonce=%d", address.value(), action, nonce);
            return result;
        });
    }

    /**
     * Credits native value to the wallet. Needs no signatures and emits no event.
     */
    public synchronized void deposit(final Wei amount) {
        Objects.requireNonNull(amount, "amount");
        transact(() -> {
            state.credit(amount);
            return null;
        });
    }

    // ═══════════════════════════════════════════════════════════════
    // Views
    // ═══════════════════════════════════════════════════════════════

    /**
     * The nonce the next action must be signed over.
     */
    public synchronized long nonce() {
        return state.nonce();
    }

    public synchronized long quorum() {
        return state.quorum();
    }

    public synchronized boolean isSigner(final @Nullable Address signer) {
        return state.isTrusted(signer);
    }

    public synchronized Wei balance() {
        return state.balance();
    }

    public Hash domainSeparator() {
        return domainSeparator;
    }

    public Eip712Domain domain() {
        return domain;
    }

    public Address address() {
        return address;
    }

    /**
     * The digest signers must approve for {@code action} at the current nonce.
     */
    public synchronized Hash digest(final MultisigAction action) {
        return DigestBuilder.buildDigest(domainSeparator, action, state.nonce());
    }

    // ═══════════════════════════════════════════════════════════════
    // Listeners
    // ═══════════════════════════════════════════════════════════════

    public void addListener(final MultisigEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public boolean removeListener(final MultisigEventListener listener) {
        return listeners.remove(listener);
    }

    // ═══════════════════════════════════════════════════════════════
    // Internals
    // ═══════════════════════════════════════════════════════════════

    private long authorize(final MultisigAction action, final List<Signature> signatures) {
        final long nonce = state.nonces().advance();
        final Hash digest = DigestBuilder.buildDigest(domainSeparator, action, nonce);
        DebugLogger.logVerification("[AUTHORIZE] wallet=%s action=%s nonce=%d digest=%s signatures=%d",
            address.value(), action.primaryType(), nonce, digest.value(), signatures.size());
        verifier.verify(digest, signatures, state.quorum(), state.signers());
        return nonce;
    }

    private HexData apply(final MultisigAction action) {
        if (action instanceof Execute execute) {
            final HexData returnData = executor.forward(execute, state);
            pendingEvents.add(new MultisigEvent.Executed(execute.target(), execute.value(), execute.payload()));
            return returnData;
        } else if (action instanceof UpdateQuorum update) {
            state.setQuorum(QuorumPolicy.of(update.newQuorum()));
            pendingEvents.add(new MultisigEvent.QuorumUpdated(update.newQuorum()));
        } else {
            final UpdateSigner update = (UpdateSigner) action;
            state.signers().setTrust(update.signer(), update.shouldTrust());
            pendingEvents.add(new MultisigEvent.SignerUpdated(update.signer(), update.shouldTrust()));
        }
        return HexData.EMPTY;
    }

    /**
     * Runs {@code body} atomically. On failure the state snapshot is restored
     * and events raised since entry are dropped; on commit of the outermost
     * transaction pending events are published.
     */
    private <T> T transact(final Supplier<T> body) {
        final MultisigState.Snapshot snapshot = state.snapshot();
        final int eventMark = pendingEvents.size();
        depth++;
        final T result;
        try {
            result = body.get();
        } catch (RuntimeException | Error e) {
            state.restore(snapshot);
            pendingEvents.subList(eventMark, pendingEvents.size()).clear();
            logRejection(e);
            throw e;
        } finally {
            depth--;
        }
        if (depth == 0) {
            publish();
        }
        return result;
    }

    private void logRejection(final Throwable e) {
        if (e instanceof AuthorizationException) {
            log.debug("Rolled back transaction on wallet {}: {}", address.value(), e.getMessage());
        } else {
            log.warn("Rolled back transaction on wallet {}", address.value(), e);
        }
    }

    private void publish() {
        if (pendingEvents.isEmpty()) {
            return;
        }
        final List<MultisigEvent> events = List.copyOf(pendingEvents);
        pendingEvents.clear();
        for (MultisigEvent event : events) {
            for (MultisigEventListener listener : listeners) {
                try {
                    listener.onEvent(event);
                } catch (RuntimeException e) {
                    log.error("Listener error for event {} on wallet {}", event, address.value(), e);
                }
            }
        }
    }
}
