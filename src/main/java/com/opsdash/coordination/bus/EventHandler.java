package com.opsdash.coordination.bus;

import com.opsdash.coordination.model.SystemEvent;

/**
 * Local subscriber callback. A {@link HandlerResult#failed} result and a thrown exception
 * are both treated as a failed delivery attempt and retried by the bus.
 */
@FunctionalInterface
public interface EventHandler {

  HandlerResult handle(SystemEvent event) throws Exception;
}
