package mc.dashboard.service.rcon;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import mc.dashboard.config.DashboardConfig;
import mc.dashboard.service.ServerNotFoundException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps at most one authenticated RCON session per managed server. Sessions are opened lazily, reused
 * until they fail or sit idle past {@code dashboard.rcon.idle-timeout}, and closed on shutdown.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RconConnectionPool {
    private final RconCredentialService credentialService;
    private final RconTransport transport;
    private final RconDiagnostics diagnostics;
    private final DashboardConfig config;
    private final Clock clock;

    private final Map<Long, PooledConnection> connections = new ConcurrentHashMap<>();
    // only holds a server while its session is being opened
    private final Map<Long, CompletableFuture<PooledConnection>> pendingConnects = new ConcurrentHashMap<>();

    /**
     * Returns the pooled session for {@code serverId}, connecting first if there is none.
     *
     * @throws ServerNotFoundException  if the server has no stored credentials
     * @throws RconConnectionException if the session cannot be opened or authenticated
     */
    public RconSession acquire(Long serverId) {
        PooledConnection existing = liveConnection(serverId);
        if (existing != null) {
            return existing.use(clock.instant());
        }

        CompletableFuture<PooledConnection> pending = new CompletableFuture<>();
        CompletableFuture<PooledConnection> inFlight = pendingConnects.putIfAbsent(serverId, pending);
        if (inFlight != null) {
            return await(inFlight).use(clock.instant());
        }
        try {
            existing = liveConnection(serverId);
            if (existing == null) {
                existing = connect(serverId);
                connections.put(serverId, existing);
            } else {
                existing.use(clock.instant());
            }
            pending.complete(existing);
            return existing.getSession();
        } catch (RuntimeException | Error e) {
            pending.completeExceptionally(e);
            throw e;
        } finally {
            pendingConnects.remove(serverId, pending);
        }
    }

    private static PooledConnection await(CompletableFuture<PooledConnection> inFlight) {
        try {
            return inFlight.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    private PooledConnection liveConnection(Long serverId) {
        PooledConnection connection = connections.get(serverId);
        if (connection != null && !connection.getSession().isOpen()) {
            evict(serverId, connection.getSession());
            return null;
        }
        return connection;
    }

    private PooledConnection connect(Long serverId) {
        RconEndpoint endpoint = credentialService.resolve(serverId);
        RconSession session;
        try {
            session = transport.open(endpoint);
        } catch (IOException e) {
            throw new RconConnectionException(serverId,
                    "Could not connect to RCON at " + endpoint.address() + ": " + e.getMessage(), e);
        }

        PooledConnection connection = new PooledConnection(serverId, session, clock.instant());
        session.onClose(() -> {
            if (connections.remove(serverId, connection)) {
                log.debug("RCON connection for server {} closed, removed from pool", serverId);
            }
        });
        log.info("Opened RCON connection to {} for server {}", endpoint.address(), serverId);
        return connection;
    }

    /**
     * Closes and removes whatever session is pooled for {@code serverId}. Idempotent.
     */
    public void evict(Long serverId) {
        PooledConnection removed = connections.remove(serverId);
        if (removed != null) {
            log.debug("Evicted RCON connection for server {}", serverId);
            closeQuietly(serverId, removed.getSession(), "evict");
        }
    }

    /**
     * Evicts {@code session} only if it is still the pooled one, so a caller holding a failed session
     * cannot remove a replacement another caller just opened. The session is closed either way.
     */
    public void evict(Long serverId, RconSession session) {
        PooledConnection current = connections.get(serverId);
        if (current != null && current.getSession() == session && connections.remove(serverId, current)) {
            log.debug("Evicted stale RCON connection for server {}", serverId);
        }
        closeQuietly(serverId, session, "evict");
    }

    public boolean contains(Long serverId) {
        return connections.containsKey(serverId);
    }

    public int size() {
        return connections.size();
    }

    int pendingConnectCount() {
        return pendingConnects.size();
    }

    public Optional<Instant> lastUsedAt(Long serverId) {
        return Optional.ofNullable(connections.get(serverId)).map(PooledConnection::getLastUsedAt);
    }

    @Scheduled(fixedDelayString = "${dashboard.rcon.reap-interval:60000}",
            initialDelayString = "${dashboard.rcon.reap-interval:60000}")
    public void reapIdleConnections() {
        int reaped = reapIdle();
        if (reaped > 0) {
            log.info("Closed {} idle RCON connection(s), {} still pooled", reaped, connections.size());
        }
    }

    /**
     * Evicts every connection unused for longer than the idle timeout.
     *
     * @return number of connections evicted
     */
    public int reapIdle() {
        Instant cutoff = clock.instant().minusMillis(config.getRcon().getIdleTimeout());
        int reaped = 0;
        for (PooledConnection connection : connections.values()) {
            if (connection.getLastUsedAt().isBefore(cutoff)
                    && connections.remove(connection.getServerId(), connection)) {
                closeQuietly(connection.getServerId(), connection.getSession(), "reap");
                reaped++;
            }
        }
        return reaped;
    }

    @PreDestroy
    public void closeAll() {
        for (Long serverId : connections.keySet()) {
            PooledConnection removed = connections.remove(serverId);
            if (removed != null) {
                closeQuietly(serverId, removed.getSession(), "shutdown");
            }
        }
        log.info("RCON connection pool closed");
    }

    private void closeQuietly(Long serverId, RconSession session, String step) {
        try {
            session.close();
        } catch (IOException | RuntimeException e) {
            diagnostics.suppressed(serverId, step, e);
        }
    }

    private static final class PooledConnection {
        private final Long serverId;
        private final RconSession session;
        private volatile Instant lastUsedAt;

        private PooledConnection(Long serverId, RconSession session, Instant createdAt) {
            this.serverId = serverId;
            this.session = session;
            this.lastUsedAt = createdAt;
        }

        RconSession use(Instant now) {
            lastUsedAt = now;
            return session;
        }

        Long getServerId() {
            return serverId;
        }

        RconSession getSession() {
            return session;
        }

        Instant getLastUsedAt() {
            return lastUsedAt;
        }
    }
}
