package mc.dashboard.service.rcon;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import mc.dashboard.service.ServerNotFoundException;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Sends single commands over pooled sessions. A send that fails on a session taken from the pool is
 * retried exactly once on a freshly opened session; a failure to open the first session is not retried.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RconCommandDispatcher {
    private final RconConnectionPool connectionPool;

    /**
     * @throws ServerNotFoundException  if the server is unknown
     * @throws RconConnectionException if no session could be opened in the first place
     * @throws RconCommandException    if the command failed on both the pooled and a fresh session
     */
    public String send(Long serverId, String command) {
        RconSession session = connectionPool.acquire(serverId);
        try {
            String response = session.send(command);
            log.debug("RCON command '{}' executed on server {}. Response: {}", command, serverId, response);
            return response;
        } catch (IOException e) {
            log.debug("RCON command '{}' failed on server {}, retrying on a fresh connection: {}",
                    command, serverId, e.getMessage());
            connectionPool.evict(serverId, session);
            return retry(serverId, command, e);
        }
    }

    private String retry(Long serverId, String command, IOException firstFailure) {
        try {
            RconSession fresh = connectionPool.acquire(serverId);
            try {
                String response = fresh.send(command);
                log.debug("RCON command '{}' executed on server {} after retry. Response: {}", command, serverId, response);
                return response;
            } catch (IOException e) {
                connectionPool.evict(serverId, fresh);
                throw e;
            }
        } catch (IOException | RconConnectionException e) {
            RconCommandException failure = new RconCommandException(serverId, command, e);
            failure.addSuppressed(firstFailure);
            log.warn("RCON command '{}' failed on server {} after retry: {}", command, serverId, e.getMessage());
            throw failure;
        }
    }
}
