package mc.dashboard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "dashboard")
public class DashboardConfig {

    private Rcon rcon = new Rcon();

    @Data
    public static class Rcon {
        private long connectTimeout = 5000;
        private long commandTimeout = 5000;
        private long idleTimeout = 5 * 60 * 1000;
        private long reapInterval = 60_000;
    }

    private Status status = new Status();

    @Data
    public static class Status {
        private long ttl = 5000;
        // 24h at 5-minute granularity
        private int historyCapacity = 288;
        private int defaultMaxPlayers = 20;
        private double tpsWarning = 18.0;
        private double tpsCritical = 15.0;
    }

    private Security security = new Security();

    @Data
    public static class Security {
        /**
         * 32-byte AES key as 64 hex characters. When empty the key is read from (or generated into)
         * {@link #secretsFile}.
         */
        private String encryptionKey;
        private String secretsFile = "data/.secrets";

        public boolean hasEncryptionKey() {
            return encryptionKey != null && !encryptionKey.trim().isEmpty();
        }
    }
}
