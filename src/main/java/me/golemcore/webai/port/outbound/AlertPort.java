package me.golemcore.webai.port.outbound;

/**
 * Operational alert sink (e.g. a chat webhook).
 */
public interface AlertPort {

    boolean isAvailable();

    void notify(String message);
}
