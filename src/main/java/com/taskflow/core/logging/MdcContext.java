package com.taskflow.core.logging;

import com.taskflow.core.model.AgentName;
import com.taskflow.core.model.GateId;
import org.slf4j.MDC;

/**
 * Utility for managing lifecycle-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTask(String taskId) {
        MDC.put("taskId", taskId);
    }

    public static void setGate(String taskId, GateId gate) {
        MDC.put("taskId", taskId);
        MDC.put("gateId", gate.key());
    }

    public static void setAgent(AgentName agent) {
        MDC.put("agent", agent.name());
    }

    public static void clearAgent() {
        MDC.remove("agent");
    }

    public static void clear() {
        MDC.remove("taskId");
        MDC.remove("gateId");
        MDC.remove("agent");
    }
}
