package mc.dashboard.service.status;

import java.util.regex.Pattern;

public interface RconPatterns {
    // "There are 3 of a max of 20 players online: Steve, Alex"; older servers omit the second "of"
    Pattern LIST_PATTERN = Pattern.compile("There are (\\d+) of a max(?: of)? (\\d+) players online:(.*)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    Pattern PLAYERS_ONLINE_PATTERN = Pattern.compile("players online:(.*)", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    // Paper/Spigot: "§6TPS from last 1m, 5m, 15m: §a19.97, §a19.98, §a*20.0"
    Pattern COLOR_CODE_PATTERN = Pattern.compile("§.");
    Pattern TPS_PATTERN = Pattern.compile(":\\s*\\*?(\\d+\\.?\\d*)");

    String LIST_COMMAND = "list";
    String TPS_COMMAND = "tps";
}
