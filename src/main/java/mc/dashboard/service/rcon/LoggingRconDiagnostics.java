package mc.dashboard.service.rcon;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingRconDiagnostics implements RconDiagnostics {

    @Override
    public void suppressed(Long serverId, String step, Throwable error) {
        log.debug("Ignored failure during '{}' for server {}: {}", step, serverId, error.toString());
    }
}
