package mc.dashboard.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StatusAnalytics {
    private List<TpsPoint> tpsHistory;
    private List<PlayerPoint> playerHistory;

    @Data
    @AllArgsConstructor
    public static class TpsPoint {
        private Instant at;
        private Double tps;
    }

    @Data
    @AllArgsConstructor
    public static class PlayerPoint {
        private Instant at;
        private int count;
    }
}
