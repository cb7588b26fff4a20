package mc.dashboard.service.rcon;

/**
 * Receives errors from best-effort steps that never propagate to the caller: closing connections during
 * eviction, reaping or shutdown, and the optional TPS probe.
 */
public interface RconDiagnostics {

    void suppressed(Long serverId, String step, Throwable error);
}
