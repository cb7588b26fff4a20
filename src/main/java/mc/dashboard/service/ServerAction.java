package mc.dashboard.service;

import java.util.Locale;

public enum ServerAction {
    STOP("stop"),
    RELOAD("reload"),
    // the container supervisor brings the server back up after it stops
    RESTART("stop");

    private final String command;

    ServerAction(String command) {
        this.command = command;
    }

    public String getCommand() {
        return command;
    }

    public static ServerAction fromName(String name) {
        try {
            return ServerAction.valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("Invalid action: " + name, e);
        }
    }
}
