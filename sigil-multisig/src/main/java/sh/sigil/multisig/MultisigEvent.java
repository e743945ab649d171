// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.multisig;

import java.util.Objects;

import sh.sigil.core.types.Address;
import sh.sigil.core.types.Hash;
import sh.sigil.core.types.HexData;
import sh.sigil.core.types.Wei;

/**
 * Event published when a wallet action commits.
 *
 * <p>Each record mirrors one event signature; {@link #topic0()} is its
 * {@code keccak256} so histories can be matched against logs produced elsewhere.
 */
public sealed interface MultisigEvent permits
        MultisigEvent.Executed,
        MultisigEvent.QuorumUpdated,
        MultisigEvent.SignerUpdated {

    Hash topic0();

    /**
     * {@code event Executed(address target, uint256 value, bytes payload)}
     */
    record Executed(Address target, Wei value, HexData payload) implements MultisigEvent {
        public static final Hash TOPIC = new Hash(
            "0xcaf938de11c367272220bfd1d2baa99ca46665e7bc4d85f00adb51b90fe1fa9f");

        public Executed {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(payload, "payload");
        }

        @Override
        public Hash topic0() {
            return TOPIC;
        }
    }

    /**
     * {@code event QuorumUpdated(uint256 newQuorum)}
     */
    record QuorumUpdated(long newQuorum) implements MultisigEvent {
        public static final Hash TOPIC = new Hash(
            "0xf18f88786aae85a652aadb99a82462616489a33370c9bcc7b245906812ef7cd1");

        @Override
        public Hash topic0() {
            return TOPIC;
        }
    }

    /**
     * {@code event SignerUpdated(address signer, bool shouldTrust)}
     */
    record SignerUpdated(Address signer, boolean shouldTrust) implements MultisigEvent {
        public static final Hash TOPIC = new Hash(
            "0xfcaa24b1276bfa7dbf77797c0a984b9df924acbeaabd48cd2f1b0eca379b78fa");

        public SignerUpdated {
            Objects.requireNonNull(signer, "signer");
        }

        @Override
        public Hash topic0() {
            return TOPIC;
        }
    }
}
