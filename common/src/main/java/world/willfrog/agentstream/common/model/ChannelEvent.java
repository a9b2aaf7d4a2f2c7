package world.willfrog.agentstream.common.model;

import world.willfrog.agentstream.common.utils.EventIds;

import java.util.OptionalLong;

/**
 * 通道中流转的一条事件：事件 ID + 原始事件。
 */
public record ChannelEvent(String eventId, RawEvent event) {

    public OptionalLong seq() {
        return EventIds.parseSeq(eventId);
    }

    public boolean isTerminal() {
        return event != null && event.isTerminal();
    }
}
