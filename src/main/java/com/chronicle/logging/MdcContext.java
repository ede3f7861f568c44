package com.chronicle.logging;

import org.slf4j.MDC;

/**
 * MDC keys for one hook invocation. The file log pattern prints {@code invocation}, {@code hook} and
 * {@code session}.
 */
public final class MdcContext {

    public static final String HOOK = "hook";
    public static final String SESSION = "session";
    public static final String INVOCATION = "invocation";

    private MdcContext() {}

    public static void setHook(String hookEventName) {
        if (hookEventName != null) {
            MDC.put(HOOK, hookEventName);
        }
    }

    public static void setSession(String externalSessionId) {
        if (externalSessionId != null) {
            MDC.put(SESSION, externalSessionId);
        }
    }

    public static void setInvocation(String invocationId) {
        if (invocationId != null) {
            MDC.put(INVOCATION, invocationId);
        }
    }

    public static void clear() {
        MDC.remove(INVOCATION);
        MDC.remove(HOOK);
        MDC.remove(SESSION);
    }
}
