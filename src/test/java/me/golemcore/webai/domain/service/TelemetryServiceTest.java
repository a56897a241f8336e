package me.golemcore.webai.domain.service;

import me.golemcore.webai.domain.model.AskCompletedEvent;
import me.golemcore.webai.infrastructure.config.WebAiProperties;
import me.golemcore.webai.port.outbound.AlertPort;
import me.golemcore.webai.port.outbound.TelemetryPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class TelemetryServiceTest {

    private static final Executor DIRECT = Runnable::run;

    private TelemetryPort telemetryPort;
    private AlertPort alertPort;
    private WebAiProperties properties;
    private TelemetryService service;

    @BeforeEach
    void setUp() {
        telemetryPort = mock(TelemetryPort.class);
        alertPort = mock(AlertPort.class);
        properties = new WebAiProperties();
        when(alertPort.isAvailable()).thenReturn(true);
        service = new TelemetryService(telemetryPort, alertPort, properties, DIRECT);
    }

    @Test
    void shouldForwardEventToTelemetrySink() {
        AskCompletedEvent event = event();

        service.recordAskCompleted(event);

        verify(telemetryPort).record(event);
    }

    @Test
    void shouldDropEventsWhenTelemetryDisabled() {
        properties.getTelemetry().setEnabled(false);

        service.recordAskCompleted(event());

        verifyNoInteractions(telemetryPort);
    }

    @Test
    void shouldSwallowSinkFailures() {
        doThrow(new IllegalStateException("sink down")).when(telemetryPort).record(any());
        doThrow(new IllegalStateException("webhook down")).when(alertPort).notify(anyString());

        assertDoesNotThrow(() -> service.recordAskCompleted(event()));
        assertDoesNotThrow(() -> service.alert("ask.error boom"));
    }

    @Test
    void shouldForwardAlertWhenSinkAvailable() {
        service.alert("ask.error boom");

        verify(alertPort).notify("ask.error boom");
    }

    @Test
    void shouldSkipAlertWhenSinkUnavailable() {
        when(alertPort.isAvailable()).thenReturn(false);

        service.alert("ask.error boom");

        verify(alertPort, never()).notify(anyString());
    }

    @Test
    void shouldDropEventWhenExecutorRejects() {
        Executor rejecting = task -> {
            throw new RejectedExecutionException("queue full");
        };
        TelemetryService saturated = new TelemetryService(telemetryPort, alertPort, properties, rejecting);

        assertDoesNotThrow(() -> saturated.recordAskCompleted(event()));
        verifyNoInteractions(telemetryPort);
    }

    private static AskCompletedEvent event() {
        return AskCompletedEvent.builder()
                .timestamp(Instant.parse("2026-01-01T00:00:00Z"))
                .userId("user-1")
                .plan("pro")
                .usedTools(List.of("math"))
                .timedOutTools(List.of())
                .erroredTools(List.of())
                .latencyMs(120)
                .build();
    }
}
