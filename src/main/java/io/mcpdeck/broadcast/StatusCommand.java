package io.mcpdeck.broadcast;

import java.util.Locale;

public record StatusCommand(Kind kind, String serverId) {
    public enum Kind {
        REFRESH,
        START,
        STOP,
        RESTART;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
