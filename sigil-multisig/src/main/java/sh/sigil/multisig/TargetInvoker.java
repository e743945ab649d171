// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.multisig;

import sh.sigil.core.types.Address;
import sh.sigil.core.types.HexData;
import sh.sigil.core.types.Wei;

/**
 * Delivers an authorized call to its target.
 *
 * <p>Called while the wallet's lock is held. An invoker may call back into the
 * same wallet; the nested call sees the nonce already advanced.
 */
@FunctionalInterface
public interface TargetInvoker {

    /**
     * @param target  the called address
     * @param value   native value sent with the call
     * @param payload call data
     * @return the call outcome; a thrown {@link RuntimeException} counts as failure
     */
    InvocationResult invoke(Address target, Wei value, HexData payload);
}
