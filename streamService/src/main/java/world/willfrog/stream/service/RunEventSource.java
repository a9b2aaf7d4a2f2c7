package world.willfrog.stream.service;

import world.willfrog.agentstream.common.model.RawEvent;
import world.willfrog.stream.model.StreamRun;

import java.util.Iterator;

/**
 * 执行引擎边界：按顺序产出某个 Run 的原始事件。
 * <p>
 * 迭代器在执行线程中被消费，线程被中断表示 Run 已被取消；
 * 抛出的异常会转成 error 事件。
 */
@FunctionalInterface
public interface RunEventSource {

    Iterator<RawEvent> stream(StreamRun run) throws Exception;
}
