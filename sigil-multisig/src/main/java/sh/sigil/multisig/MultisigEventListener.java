// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.multisig;

/**
 * Receives events after the transaction that raised them commits.
 *
 * <p>Invoked on the committing thread with the wallet lock held. An exception
 * thrown here is logged and does not affect the committed state or other
 * listeners.
 */
@FunctionalInterface
public interface MultisigEventListener {

    void onEvent(MultisigEvent event);
}
