package mc.dashboard.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import mc.dashboard.model.ServerStatus;
import mc.dashboard.model.StatusSample;
import mc.dashboard.service.rcon.RconCommandDispatcher;
import mc.dashboard.service.rcon.RconConnectionPool;
import mc.dashboard.service.rcon.RconException;
import mc.dashboard.service.status.RconPatterns;
import mc.dashboard.service.status.SampleHistory;
import mc.dashboard.service.status.ServerStatusCache;
import mc.dashboard.service.status.StatusReplyParser;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for everything outside the RCON layer: route handlers, schedulers and player management
 * call in here rather than touching the pool, cache or history directly.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RconService {
    private final RconCommandDispatcher commandDispatcher;
    private final RconConnectionPool connectionPool;
    private final ServerStatusCache statusCache;
    private final SampleHistory sampleHistory;
    private final StatusReplyParser replyParser;

    /**
     * @throws ServerNotFoundException if the server is unknown
     * @throws RconException           if the command could not be delivered
     */
    public String sendCommand(Long serverId, String command) {
        return commandDispatcher.send(serverId, command);
    }

    public CompletableFuture<String> sendCommandAsync(Long serverId, String command) {
        return CompletableFuture.supplyAsync(() -> sendCommand(serverId, command));
    }

    /**
     * Cached for {@code dashboard.status.ttl}. Never fails for an unreachable server; that is reported as
     * {@code online=false}.
     */
    public ServerStatus getServerStatus(Long serverId) {
        return statusCache.getStatus(serverId);
    }

    public void invalidateStatus(Long serverId) {
        statusCache.invalidate(serverId);
    }

    public List<StatusSample> getHistory(Long serverId) {
        return sampleHistory.history(serverId);
    }

    public List<String> getOnlinePlayers(Long serverId) {
        return replyParser.parsePlayerNames(sendCommand(serverId, RconPatterns.LIST_COMMAND));
    }

    public boolean testConnection(Long serverId) {
        try {
            connectionPool.acquire(serverId);
            return true;
        } catch (RconException e) {
            log.debug("RCON connection test failed for server {}: {}", serverId, e.getMessage());
            return false;
        }
    }

    /**
     * Drops pooled connection, cached status and samples, e.g. after credentials changed or the server
     * was removed.
     */
    public void forget(Long serverId, boolean clearHistory) {
        connectionPool.evict(serverId);
        statusCache.invalidate(serverId);
        if (clearHistory) {
            sampleHistory.clear(serverId);
        }
    }
}
