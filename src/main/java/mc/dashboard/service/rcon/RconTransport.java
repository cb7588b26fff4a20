package mc.dashboard.service.rcon;

import java.io.IOException;

public interface RconTransport {

    /**
     * Opens and authenticates a session. Fails if the server cannot be reached or rejects the password
     * within the connect timeout.
     */
    RconSession open(RconEndpoint endpoint) throws IOException;
}
