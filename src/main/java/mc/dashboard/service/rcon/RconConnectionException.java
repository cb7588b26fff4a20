package mc.dashboard.service.rcon;

/**
 * The transport could not be established or authentication was rejected.
 */
public class RconConnectionException extends RconException {

    public RconConnectionException(Long serverId, String message, Throwable cause) {
        super(serverId, message, cause);
    }
}
