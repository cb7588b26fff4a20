package mc.dashboard.service.status;

import lombok.Value;

import java.util.List;

@Value
public class PlayerListReply {
    int playerCount;
    int maxPlayers;
    List<String> players;
}
