// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.multisig;

import java.util.Objects;

import sh.sigil.core.types.HexData;

/**
 * Outcome of a forwarded call.
 *
 * @param success    whether the target accepted the call
 * @param returnData data the target returned (revert data on failure)
 */
public record InvocationResult(boolean success, HexData returnData) {

    public InvocationResult {
        Objects.requireNonNull(returnData, "returnData");
    }

    public static InvocationResult ok(final HexData returnData) {
        return new InvocationResult(true, returnData);
    }

    public static InvocationResult ok() {
        return new InvocationResult(true, HexData.EMPTY);
    }

    public static InvocationResult reverted(final HexData returnData) {
        return new InvocationResult(false, returnData);
    }

    public static InvocationResult reverted() {
        return new InvocationResult(false, HexData.EMPTY);
    }
}
