// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.multisig;

import java.util.Objects;

import sh.sigil.core.DebugLogger;
import sh.sigil.core.error.ExecutionFailedException;
import sh.sigil.core.types.HexData;

/**
 * Forwards an authorized {@link Execute} to the {@link TargetInvoker}.
 *
 * <p>The attached value is debited from the wallet balance before the call.
 * Any failure (insufficient balance, a failed result, or an exception thrown
 * by the invoker) becomes an {@link ExecutionFailedException}; the wallet
 * then rolls the whole action back, debit included.
 */
public final class Executor {

    private final TargetInvoker invoker;

    public Executor(final TargetInvoker invoker) {
        this.invoker = Objects.requireNonNull(invoker, "invoker");
    }

    HexData forward(final Execute action, final MultisigState state) {
        if (state.balance().compareTo(action.value()) < 0) {
            throw new ExecutionFailedException(action.target(),
                "has insufficient balance: " + state.balance().value() + " < " + action.value().value(), null);
        }
        state.debit(action.value());

        final InvocationResult result;
        try {
            result = invoker.invoke(action.target(), action.value(), action.payload());
        } catch (RuntimeException e) {
            throw new ExecutionFailedException(action.target(), "threw " + e, e);
        }
        if (result == null) {
            throw new ExecutionFailedException(action.target(), "returned no result", null);
        }

        DebugLogger.logExecution("[CALL] target=%s value=%s success=%s returnData=%s",
            action.target().value(), action.value().value(), result.success(), result.returnData().value());
        if (!result.success()) {
            throw new ExecutionFailedException(action.target(), result.returnData());
        }
        return result.returnData();
    }
}
