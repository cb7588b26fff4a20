package mc.dashboard.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class ServerActionService {
    private final RconService rconService;

    public String perform(Long serverId, ServerAction action) {
        log.info("Performing {} on server {}", action, serverId);
        try {
            return rconService.sendCommand(serverId, action.getCommand());
        } finally {
            rconService.invalidateStatus(serverId);
        }
    }
}
