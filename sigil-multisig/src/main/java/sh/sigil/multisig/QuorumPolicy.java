// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.multisig;

/**
 * Number of valid signatures an action needs.
 *
 * <p>Zero is valid and disables authorization entirely. A threshold above the
 * number of trusted signers is also accepted; it locks the wallet until no
 * action can ever pass.
 *
 * @param required the threshold
 */
public record QuorumPolicy(long required) {

    public QuorumPolicy {
        if (required < 0) {
            throw new IllegalArgumentException("quorum must be non-negative, got " + required);
        }
    }

    public static QuorumPolicy of(final long required) {
        return new QuorumPolicy(required);
    }
}
