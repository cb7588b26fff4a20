package mc.dashboard.service.rcon;

/**
 * A command could not be delivered, even after retrying on a fresh connection.
 */
public class RconCommandException extends RconException {

    public RconCommandException(Long serverId, String command, Throwable cause) {
        super(serverId, "RCON command '" + command + "' failed on server " + serverId + ": " + cause.getMessage(), cause);
    }
}
