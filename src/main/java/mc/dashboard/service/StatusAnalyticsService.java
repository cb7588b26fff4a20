package mc.dashboard.service;

import lombok.RequiredArgsConstructor;
import mc.dashboard.config.DashboardConfig;
import mc.dashboard.dto.StatusAnalytics;
import mc.dashboard.model.ServerStatus;
import mc.dashboard.model.StatusAlert;
import mc.dashboard.model.StatusSample;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class StatusAnalyticsService {
    private final RconService rconService;
    private final DashboardConfig config;
    private final Clock clock;

    public StatusAnalytics getAnalytics(Long serverId) {
        List<StatusSample> history = rconService.getHistory(serverId);
        return StatusAnalytics.builder()
                .tpsHistory(history.stream()
                        .map(s -> new StatusAnalytics.TpsPoint(s.getAt(), s.getTps()))
                        .collect(Collectors.toList()))
                .playerHistory(history.stream()
                        .map(s -> new StatusAnalytics.PlayerPoint(s.getAt(), s.getPlayers()))
                        .collect(Collectors.toList()))
                .build();
    }

    /**
     * Alerts derived from the current status: offline, or TPS under the configured thresholds.
     */
    public List<StatusAlert> getStatusAlerts(Long serverId) {
        ServerStatus status = rconService.getServerStatus(serverId);
        DashboardConfig.Status thresholds = config.getStatus();
        List<StatusAlert> alerts = new ArrayList<>();

        if (!status.isOnline()) {
            alerts.add(alert("status-offline", StatusAlert.Severity.CRITICAL, "Server is offline",
                    "The Minecraft server is not responding to RCON commands."));
        } else if (status.getTps() != null && status.getTps() < thresholds.getTpsCritical()) {
            alerts.add(alert("status-tps-critical", StatusAlert.Severity.CRITICAL,
                    String.format(Locale.ROOT, "TPS critical: %.1f", status.getTps()),
                    String.format(Locale.ROOT, "Current TPS is %.1f (below %.0f). Server is severely lagging.",
                            status.getTps(), thresholds.getTpsCritical())));
        } else if (status.getTps() != null && status.getTps() < thresholds.getTpsWarning()) {
            alerts.add(alert("status-tps-warning", StatusAlert.Severity.WARNING,
                    String.format(Locale.ROOT, "TPS warning: %.1f", status.getTps()),
                    String.format(Locale.ROOT, "Current TPS is %.1f (below %.0f). Server may be experiencing lag.",
                            status.getTps(), thresholds.getTpsWarning())));
        }
        return alerts;
    }

    private StatusAlert alert(String id, StatusAlert.Severity severity, String message, String detail) {
        return StatusAlert.builder()
                .id(id)
                .severity(severity)
                .message(message)
                .detail(detail)
                .at(clock.instant())
                .build();
    }
}
