package mc.dashboard.model;

import lombok.Value;

import java.time.Instant;

@Value
public class StatusSample {
    Instant at;
    Double tps;
    int players;
}
