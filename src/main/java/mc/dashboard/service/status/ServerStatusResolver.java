package mc.dashboard.service.status;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import mc.dashboard.model.ServerStatus;
import mc.dashboard.service.ServerNotFoundException;
import mc.dashboard.service.rcon.RconCommandDispatcher;
import mc.dashboard.service.rcon.RconDiagnostics;
import mc.dashboard.service.rcon.RconException;
import org.springframework.stereotype.Service;

import static mc.dashboard.service.status.RconPatterns.LIST_COMMAND;
import static mc.dashboard.service.status.RconPatterns.TPS_COMMAND;

/**
 * Builds a {@link ServerStatus} from fresh RCON replies and records a sample for every resolution.
 * Callers should go through {@link ServerStatusCache}; this class does no memoization.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ServerStatusResolver {
    private final RconCommandDispatcher commandDispatcher;
    private final StatusReplyParser replyParser;
    private final SampleHistory sampleHistory;
    private final RconDiagnostics diagnostics;

    /**
     * An unreachable server resolves to {@link ServerStatus#offline()} rather than an error.
     *
     * @throws ServerNotFoundException if the server is unknown
     */
    public ServerStatus resolve(Long serverId) {
        String listReply;
        try {
            listReply = commandDispatcher.send(serverId, LIST_COMMAND);
        } catch (RconException e) {
            log.debug("Server {} did not answer '{}', reporting offline: {}", serverId, LIST_COMMAND, e.getMessage());
            sampleHistory.record(serverId, null, 0);
            return ServerStatus.offline();
        }

        PlayerListReply players = replyParser.parsePlayerList(listReply);
        Double tps = probeTps(serverId);

        sampleHistory.record(serverId, tps, players.getPlayerCount());
        return ServerStatus.builder()
                .online(true)
                .players(players.getPlayers())
                .playerCount(players.getPlayerCount())
                .maxPlayers(players.getMaxPlayers())
                .tps(tps)
                .build();
    }

    // Vanilla has no tps command; any failure here just means "unknown".
    private Double probeTps(Long serverId) {
        try {
            return replyParser.parseTps(commandDispatcher.send(serverId, TPS_COMMAND));
        } catch (RconException e) {
            diagnostics.suppressed(serverId, TPS_COMMAND, e);
            return null;
        }
    }
}
