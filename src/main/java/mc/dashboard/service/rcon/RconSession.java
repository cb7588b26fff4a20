package mc.dashboard.service.rcon;

import java.io.Closeable;
import java.io.IOException;

/**
 * An open, authenticated RCON connection. Implementations allow one request in flight at a time.
 */
public interface RconSession extends Closeable {

    /**
     * Sends a command and waits for its reply.
     *
     * @throws IOException on transport failure or timeout; the session is closed afterwards
     */
    String send(String command) throws IOException;

    boolean isOpen();

    /**
     * Registers a callback run once when the session closes, whether closed locally or because the
     * connection failed. Runs immediately if the session is already closed.
     */
    void onClose(Runnable listener);
}
