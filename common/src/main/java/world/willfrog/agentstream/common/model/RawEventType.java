package world.willfrog.agentstream.common.model;

import java.util.Locale;

/**
 * 执行引擎产出的原始事件类型。
 */
public enum RawEventType {
    VALUES,
    MESSAGES,
    UPDATES,
    DEBUG,
    CUSTOM,
    END,
    ERROR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RawEventType fromWireName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("raw event type is null");
        }
        for (RawEventType type : values()) {
            if (type.wireName().equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unknown raw event type: " + name);
    }
}
