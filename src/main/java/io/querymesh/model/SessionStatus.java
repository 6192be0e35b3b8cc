package io.querymesh.model;

public enum SessionStatus {
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this != PROCESSING;
    }

    public static SessionStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Session status cannot be empty");
        }
        for (SessionStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown session status: " + raw);
    }
}
