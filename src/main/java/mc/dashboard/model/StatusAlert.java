package mc.dashboard.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StatusAlert {
    private String id;
    private Severity severity;
    private String message;
    private String detail;
    private Instant at;

    public enum Severity {
        CRITICAL,
        WARNING,
        INFO
    }
}
