package world.willfrog.agentstream.common.model;

import java.util.Locale;

/**
 * Run 的终态（以及运行中）状态。
 */
public enum RunStatus {
    RUNNING,
    SUCCESS,
    ERROR,
    INTERRUPTED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }

    public static RunStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("run status is blank");
        }
        return RunStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
