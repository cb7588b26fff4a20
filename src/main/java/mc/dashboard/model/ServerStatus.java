package mc.dashboard.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Point-in-time view of a managed server as seen over RCON. {@code tps} is {@code null} when the
 * server software does not expose it (vanilla). Instances are shared by every reader of the status
 * cache, so they are immutable.
 */
@Value
public class ServerStatus {
    boolean online;
    List<String> players;
    int playerCount;
    int maxPlayers;
    Double tps;

    @Builder
    private ServerStatus(boolean online, List<String> players, int playerCount, int maxPlayers, Double tps) {
        this.online = online;
        this.players = players == null ? List.of() : List.copyOf(players);
        this.playerCount = playerCount;
        this.maxPlayers = maxPlayers;
        this.tps = tps;
    }

    public static ServerStatus offline() {
        return ServerStatus.builder()
                .online(false)
                .playerCount(0)
                .maxPlayers(0)
                .tps(null)
                .build();
    }
}
