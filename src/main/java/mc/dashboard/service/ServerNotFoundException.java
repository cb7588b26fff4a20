package mc.dashboard.service;

public class ServerNotFoundException extends RuntimeException {

    private final Long serverId;

    public ServerNotFoundException(Long serverId) {
        super("Server " + serverId + " not found");
        this.serverId = serverId;
    }

    public Long getServerId() {
        return serverId;
    }
}
