package world.willfrog.stream.model;

import java.time.OffsetDateTime;

/**
 * 某个 Run 在事件日志中的概况。
 *
 * @param eventCount 按序号跨度计算：最大序号 - 最小序号 + 1，只有一行时为 1
 */
public record RunEventInfo(String runId, long eventCount, String lastEventId, OffsetDateTime lastEventTime) {
}
