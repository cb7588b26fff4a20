package mc.dashboard.service.status;

import lombok.RequiredArgsConstructor;
import mc.dashboard.config.DashboardConfig;
import mc.dashboard.model.ServerStatus;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Short-lived memoization of {@link ServerStatusResolver} results, bounding RCON traffic when many
 * clients poll the same server.
 */
@Service
@RequiredArgsConstructor
public class ServerStatusCache {
    private final ServerStatusResolver resolver;
    private final DashboardConfig config;
    private final Clock clock;

    private final Map<Long, CachedStatus> entries = new ConcurrentHashMap<>();
    // only holds a server while its status is being resolved
    private final Map<Long, CompletableFuture<ServerStatus>> pendingRefills = new ConcurrentHashMap<>();

    public ServerStatus getStatus(Long serverId) {
        CachedStatus cached = entries.get(serverId);
        if (cached != null && cached.isFresh(clock.instant())) {
            return cached.status;
        }
        CompletableFuture<ServerStatus> pending = new CompletableFuture<>();
        CompletableFuture<ServerStatus> inFlight = pendingRefills.putIfAbsent(serverId, pending);
        if (inFlight != null) {
            return await(inFlight);
        }
        try {
            cached = entries.get(serverId);
            ServerStatus status;
            if (cached != null && cached.isFresh(clock.instant())) {
                status = cached.status;
            } else {
                status = resolver.resolve(serverId);
                entries.put(serverId, new CachedStatus(status, clock.instant()));
            }
            pending.complete(status);
            return status;
        } catch (RuntimeException | Error e) {
            pending.completeExceptionally(e);
            throw e;
        } finally {
            pendingRefills.remove(serverId, pending);
        }
    }

    private static ServerStatus await(CompletableFuture<ServerStatus> inFlight) {
        try {
            return inFlight.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    public void invalidate(Long serverId) {
        entries.remove(serverId);
    }

    int size() {
        return entries.size();
    }

    int pendingRefillCount() {
        return pendingRefills.size();
    }

    private final class CachedStatus {
        private final ServerStatus status;
        private final Instant computedAt;

        private CachedStatus(ServerStatus status, Instant computedAt) {
            this.status = status;
            this.computedAt = computedAt;
        }

        boolean isFresh(Instant now) {
            return Duration.between(computedAt, now).toMillis() < config.getStatus().getTtl();
        }
    }
}
