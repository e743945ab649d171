// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.multisig;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import sh.sigil.core.DebugLogger;
import sh.sigil.core.crypto.Signature;
import sh.sigil.core.error.InvalidSignaturesException;
import sh.sigil.core.error.MissingSignaturesException;
import sh.sigil.core.types.Address;
import sh.sigil.core.types.Hash;

/**
 * Checks that the first {@code quorum} signatures come from distinct trusted
 * signers in strictly ascending address order.
 *
 * <p>Starting from {@link Address#ZERO}, each of the first {@code quorum}
 * entries is recovered and must be trusted and strictly greater than the
 * previous signer. Entries beyond {@code quorum} are never read. The ordering
 * rule makes duplicates impossible without keeping a seen-set.
 */
public final class SignatureVerifier {

    private final SignerRecovery recovery;

    public SignatureVerifier(final SignerRecovery recovery) {
        this.recovery = Objects.requireNonNull(recovery, "recovery");
    }

    /**
     * @param digest     the digest the signatures must cover
     * @param signatures the submitted signatures, ascending by signer
     * @param quorum     number of entries to check
     * @param registry   the trusted set at verification time
     * @return the recovered signers, in order
     * @throws InvalidSignaturesException if an entry recovers to an untrusted or non-ascending signer
     * @throws MissingSignaturesException if the list ends before {@code quorum} entries were checked
     */
    public List<Address> verify(
            final Hash digest,
            final List<Signature> signatures,
            final long quorum,
            final SignerRegistry registry) {
        Objects.requireNonNull(digest, "digest");
        Objects.requireNonNull(signatures, "signatures");
        Objects.requireNonNull(registry, "registry");

        final List<Address> recovered = new ArrayList<>();
        Address previous = Address.ZERO;
        for (long i = 0; i < quorum; i++) {
            if (i >= signatures.size()) {
                throw new MissingSignaturesException(quorum, signatures.size());
            }
            final int index = (int) i;
            final Address signer = recovery.recover(digest, Objects.requireNonNull(signatures.get(index), "signature"));
            DebugLogger.logVerification("[VERIFY] digest=%s index=%d signer=%s", digest.value(), index, signer.value());

            if (!registry.isTrusted(signer) || previous.compareTo(signer) >= 0) {
                throw new InvalidSignaturesException(index, signer);
            }
            recovered.add(signer);
            previous = signer;
        }
        return recovered;
    }
}
