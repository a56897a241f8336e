package me.golemcore.webai.port.outbound;

import me.golemcore.webai.domain.model.AskCompletedEvent;

/**
 * Analytics sink for workflow outcomes.
 */
public interface TelemetryPort {

    void record(AskCompletedEvent event);
}
