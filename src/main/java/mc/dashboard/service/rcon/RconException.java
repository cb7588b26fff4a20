package mc.dashboard.service.rcon;

/**
 * Base type for failures talking to a managed server over RCON.
 */
public class RconException extends RuntimeException {

    private final Long serverId;

    public RconException(Long serverId, String message, Throwable cause) {
        super(message, cause);
        this.serverId = serverId;
    }

    public Long getServerId() {
        return serverId;
    }
}
