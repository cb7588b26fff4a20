package mc.dashboard.service.status;

import lombok.RequiredArgsConstructor;
import mc.dashboard.config.DashboardConfig;
import mc.dashboard.model.StatusSample;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded per-server history of TPS and player-count samples, oldest first. One sample is taken per
 * fresh status resolution, so the spacing follows cache misses rather than a fixed period.
 */
@Component
@RequiredArgsConstructor
public class SampleHistory {
    private final DashboardConfig config;
    private final Clock clock;

    private final Map<Long, Deque<StatusSample>> samples = new ConcurrentHashMap<>();

    public void record(Long serverId, Double tps, int players) {
        int capacity = config.getStatus().getHistoryCapacity();
        Deque<StatusSample> buffer = samples.computeIfAbsent(serverId, id -> new ArrayDeque<>(capacity));
        synchronized (buffer) {
            while (buffer.size() >= capacity) {
                buffer.pollFirst();
            }
            buffer.addLast(new StatusSample(clock.instant(), tps, players));
        }
    }

    /**
     * @return a snapshot, oldest sample first
     */
    public List<StatusSample> history(Long serverId) {
        Deque<StatusSample> buffer = samples.get(serverId);
        if (buffer == null) {
            return Collections.emptyList();
        }
        synchronized (buffer) {
            return List.copyOf(buffer);
        }
    }

    public void clear(Long serverId) {
        samples.remove(serverId);
    }
}
