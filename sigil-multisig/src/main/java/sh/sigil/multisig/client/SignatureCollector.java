// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.multisig.client;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import sh.sigil.core.crypto.Signature;
import sh.sigil.core.crypto.Signer;
import sh.sigil.core.crypto.eip712.Eip712Domain;
import sh.sigil.core.types.Address;
import sh.sigil.core.types.Hash;
import sh.sigil.multisig.DigestBuilder;
import sh.sigil.multisig.EcdsaSignerRecovery;
import sh.sigil.multisig.MultisigAction;
import sh.sigil.multisig.SignerRecovery;

/**
 * Gathers approvals for one action from a set of local signers.
 *
 * <p>The wallet only accepts signatures ordered by strictly ascending signer
 * address, so {@link #collect} returns them sorted that way, ready to submit.
 *
 * <pre>{@code
 * var collector = new SignatureCollector(wallet.domain());
 * List<Signature> sigs = collector.collect(action, wallet.nonce(), List.of(alice, bob));
 * wallet.submit(action, sigs);
 * }</pre>
 */
public final class SignatureCollector {

    private final Hash domainSeparator;
    private final SignerRecovery recovery;

    public SignatureCollector(final Eip712Domain domain) {
        this(Objects.requireNonNull(domain, "domain").separator());
    }

    public SignatureCollector(final Hash domainSeparator) {
        this(domainSeparator, EcdsaSignerRecovery.INSTANCE);
    }

    public SignatureCollector(final Hash domainSeparator, final SignerRecovery recovery) {
        this.domainSeparator = Objects.requireNonNull(domainSeparator, "domainSeparator");
        this.recovery = Objects.requireNonNull(recovery, "recovery");
    }

    /**
     * The digest every signer approves for {@code action} at {@code nonce}.
     */
    public Hash digest(final MultisigAction action, final long nonce) {
        return DigestBuilder.buildDigest(domainSeparator, action, nonce);
    }

    /**
     * Signs the action with each signer and orders the result for submission.
     *
     * @param action  the action to approve
     * @param nonce   the wallet nonce the approval is bound to
     * @param signers the approving signers, in any order
     * @return signatures sorted ascending by signer address
     */
    public List<Signature> collect(
            final MultisigAction action, final long nonce, final Collection<? extends Signer> signers) {
        Objects.requireNonNull(signers, "signers");
        final Hash digest = digest(action, nonce);
        final List<Signature> signatures = new ArrayList<>(signers.size());
        for (Signer signer : signers) {
            signatures.add(signer.signHash(digest));
        }
        return sortBySigner(digest, signatures, recovery);
    }

    /**
     * Orders signatures ascending by the address each recovers to over {@code digest}.
     *
     * @param digest     the signed digest
     * @param signatures signatures in any order
     * @param recovery   address recovery
     * @return a new list in submission order
     */
    public static List<Signature> sortBySigner(
            final Hash digest, final Collection<Signature> signatures, final SignerRecovery recovery) {
        Objects.requireNonNull(digest, "digest");
        Objects.requireNonNull(signatures, "signatures");
        Objects.requireNonNull(recovery, "recovery");
        final List<Recovered> recovered = new ArrayList<>(signatures.size());
        for (Signature signature : signatures) {
            recovered.add(new Recovered(recovery.recover(digest, signature), signature));
        }
        recovered.sort(Comparator.comparing(Recovered::signer));
        final List<Signature> sorted = new ArrayList<>(recovered.size());
        for (Recovered entry : recovered) {
            sorted.add(entry.signature());
        }
        return sorted;
    }

    private record Recovered(Address signer, Signature signature) {}
}
