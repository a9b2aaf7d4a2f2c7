package world.willfrog.stream.entity;

import lombok.Data;

import java.time.OffsetDateTime;

/**
 * 事件日志中的一行。
 */
@Data
public class RunEvent {
    private String id;          // {runId}_event_{seq}
    private String runId;
    private Long seq;
    private String eventType;
    private String dataJson;    // JSON string
    private OffsetDateTime createdAt;
}
