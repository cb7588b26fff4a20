package mc.dashboard.service.status;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import mc.dashboard.config.DashboardConfig;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;

import static mc.dashboard.service.status.RconPatterns.*;

/**
 * Reply formats of vanilla and Paper/Spigot-family servers.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MinecraftStatusParser implements StatusReplyParser {
    static final double MAX_TPS = 20.0;

    private final DashboardConfig config;

    @Override
    public PlayerListReply parsePlayerList(String reply) {
        int defaultMax = config.getStatus().getDefaultMaxPlayers();
        if (reply == null) {
            return new PlayerListReply(0, defaultMax, Collections.emptyList());
        }
        Matcher matcher = LIST_PATTERN.matcher(stripColorCodes(reply));
        if (!matcher.find()) {
            log.debug("Unrecognised list reply: {}", reply);
            return new PlayerListReply(0, defaultMax, Collections.emptyList());
        }
        try {
            int playerCount = Integer.parseInt(matcher.group(1));
            int maxPlayers = Integer.parseInt(matcher.group(2));
            return new PlayerListReply(playerCount, maxPlayers, splitNames(matcher.group(3)));
        } catch (NumberFormatException e) {
            log.debug("Error parsing player counts from list reply: {}", reply);
            return new PlayerListReply(0, defaultMax, Collections.emptyList());
        }
    }

    @Override
    public List<String> parsePlayerNames(String reply) {
        if (reply == null) {
            return Collections.emptyList();
        }
        Matcher matcher = PLAYERS_ONLINE_PATTERN.matcher(stripColorCodes(reply));
        return matcher.find() ? splitNames(matcher.group(1)) : Collections.emptyList();
    }

    @Override
    public Double parseTps(String reply) {
        if (reply == null) {
            return null;
        }
        Matcher matcher = TPS_PATTERN.matcher(stripColorCodes(reply));
        if (!matcher.find()) {
            return null;
        }
        try {
            return Math.min(MAX_TPS, Double.parseDouble(matcher.group(1)));
        } catch (NumberFormatException e) {
            log.debug("Failed to parse TPS from reply: {}", reply);
            return null;
        }
    }

    static String stripColorCodes(String text) {
        return COLOR_CODE_PATTERN.matcher(text).replaceAll("");
    }

    private static List<String> splitNames(String names) {
        if (names == null) {
            return Collections.emptyList();
        }
        List<String> players = new ArrayList<>();
        for (String name : names.split(",")) {
            String trimmed = name.trim();
            if (!trimmed.isEmpty()) {
                players.add(trimmed);
            }
        }
        return Collections.unmodifiableList(players);
    }
}
