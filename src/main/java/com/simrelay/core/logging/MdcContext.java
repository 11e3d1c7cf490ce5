package com.simrelay.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing relay-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setCommand(String commandId) {
        MDC.put("commandId", commandId);
    }

    public static void setClient(String clientId) {
        if (clientId != null) {
            MDC.put("clientId", clientId);
        }
    }

    public static void clear() {
        MDC.remove("commandId");
        MDC.remove("clientId");
    }
}
