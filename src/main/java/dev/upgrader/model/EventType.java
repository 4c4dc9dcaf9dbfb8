package dev.upgrader.model;

import java.util.Locale;

public enum EventType {
    INFO, ERROR, DONE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
