// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.multisig;

import sh.sigil.core.types.HexData;
import sh.sigil.core.types.Wei;

/**
 * Behavior of one target registered on a {@link CallRouter}.
 */
@FunctionalInterface
public interface CallHandler {

    InvocationResult handle(Wei value, HexData payload);
}
