package mc.dashboard.service.status;

import java.util.List;

/**
 * Turns raw command replies into status fields. Implementations never throw on unexpected text; they
 * fall back to defaults so one odd reply cannot fail a whole status read.
 */
public interface StatusReplyParser {

    /**
     * Parses the reply to {@code list}. Unrecognised text yields no players and the default max.
     */
    PlayerListReply parsePlayerList(String reply);

    /**
     * Parses the names listed after "players online:", or an empty list.
     */
    List<String> parsePlayerNames(String reply);

    /**
     * Parses the reply to {@code tps}.
     *
     * @return the most recent TPS value capped at 20, or {@code null} if the reply carries none
     */
    Double parseTps(String reply);
}
