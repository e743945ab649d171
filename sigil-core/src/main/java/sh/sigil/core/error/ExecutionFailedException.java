// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.error;

import org.jspecify.annotations.Nullable;

import sh.sigil.core.types.Address;
import sh.sigil.core.types.HexData;

/**
 * The authorized call to an external target reported failure.
 *
 * @since 0.1.0
 */
public final class ExecutionFailedException extends AuthorizationException {

    /** 4-byte selector of {@code ExecutionFailed()}. */
    public static final String SELECTOR = "0xacfdb444";

    private final Address target;
    private final @Nullable HexData returnData;

    public ExecutionFailedException(final Address target, final @Nullable HexData returnData) {
        super("Execution failed: call to " + target.value() + " reverted"
                + (returnData != null && returnData.byteLength() > 0 ? ", returnData=" + returnData.value() : ""));
        this.target = target;
        this.returnData = returnData;
    }

    public ExecutionFailedException(final Address target, final String reason, final @Nullable Throwable cause) {
        super("Execution failed: call to " + target.value() + " " + reason, cause);
        this.target = target;
        this.returnData = null;
    }

    public Address target() {
        return target;
    }

    /**
     * Data returned by the failing call, or null if none was produced.
     */
    public @Nullable HexData returnData() {
        return returnData;
    }
}
