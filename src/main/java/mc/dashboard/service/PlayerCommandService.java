package mc.dashboard.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.regex.Pattern;

/**
 * Player moderation commands. Each one changes what {@code list} reports, so the cached status is
 * dropped after the command lands.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlayerCommandService {
    private static final Pattern PLAYER_NAME = Pattern.compile("[A-Za-z0-9_]{1,16}");

    private final RconService rconService;

    public String kickPlayer(Long serverId, String playerName, String reason) {
        return run(serverId, withReason(String.format("kick %s", checkName(playerName)), reason));
    }

    public String banPlayer(Long serverId, String playerName, String reason) {
        return run(serverId, withReason(String.format("ban %s", checkName(playerName)), reason));
    }

    public String pardonPlayer(Long serverId, String playerName) {
        return run(serverId, String.format("pardon %s", checkName(playerName)));
    }

    public String opPlayer(Long serverId, String playerName) {
        return run(serverId, String.format("op %s", checkName(playerName)));
    }

    public String deopPlayer(Long serverId, String playerName) {
        return run(serverId, String.format("deop %s", checkName(playerName)));
    }

    public String addToWhitelist(Long serverId, String playerName) {
        return run(serverId, String.format("whitelist add %s", checkName(playerName)));
    }

    public String removeFromWhitelist(Long serverId, String playerName) {
        return run(serverId, String.format("whitelist remove %s", checkName(playerName)));
    }

    private String run(Long serverId, String command) {
        log.info("Sending player command to server {}: {}", serverId, command);
        try {
            return rconService.sendCommand(serverId, command);
        } finally {
            rconService.invalidateStatus(serverId);
        }
    }

    private static String withReason(String command, String reason) {
        if (reason == null || reason.trim().isEmpty()) {
            return command;
        }
        return command + " " + reason.replaceAll("[\\r\\n]+", " ").trim();
    }

    private static String checkName(String playerName) {
        if (playerName == null || !PLAYER_NAME.matcher(playerName).matches()) {
            throw new IllegalArgumentException("Invalid player name: " + playerName);
        }
        return playerName;
    }
}
