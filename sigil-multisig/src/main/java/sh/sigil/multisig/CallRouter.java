// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.multisig;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.sigil.core.types.Address;
import sh.sigil.core.types.HexData;
import sh.sigil.core.types.Wei;

/**
 * {@link TargetInvoker} that dispatches on the target address.
 *
 * <p>A target with no registered handler behaves like an account with no code:
 * the call succeeds and returns no data, whatever the payload.
 *
 * <pre>{@code
 * var router = new CallRouter()
 *     .register(vault, (value, payload) -> InvocationResult.ok())
 *     .register(broken, (value, payload) -> InvocationResult.reverted());
 * var wallet = MultisigWallet.create(config, router);
 * }</pre>
 */
public final class CallRouter implements TargetInvoker {

    private static final Logger log = LoggerFactory.getLogger(CallRouter.class);

    private final Map<Address, CallHandler> handlers = new ConcurrentHashMap<>();

    public CallRouter register(final Address target, final CallHandler handler) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(handler, "handler");
        handlers.put(target, handler);
        return this;
    }

    public boolean unregister(final Address target) {
        return handlers.remove(target) != null;
    }

    public boolean isRegistered(final Address target) {
        return handlers.containsKey(target);
    }

    @Override
    public InvocationResult invoke(final Address target, final Wei value, final HexData payload) {
        Objects.requireNonNull(target, "target");
        final CallHandler handler = handlers.get(target);
        if (handler == null) {
            log.debug("No handler for {}, treating call as plain transfer of {} wei", target.value(), value.value());
            return InvocationResult.ok();
        }
        return Objects.requireNonNull(handler.handle(value, payload), "handler result");
    }
}
