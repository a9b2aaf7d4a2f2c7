package world.willfrog.stream.channel;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import world.willfrog.stream.config.RunStreamProperties;

import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Run 通道注册中心。
 * <p>
 * 负责按模式选择后端、按 runId 创建或复用通道、分布式后端故障时降级到进程内后端，
 * 以及定期回收已结束的通道。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RunChannelRegistry {

    private final InMemoryChannelBackend inMemoryBackend;
    private final RedisChannelBackend redisBackend;
    private final RunStreamProperties properties;

    private final Map<String, RunChannel> channels = new ConcurrentHashMap<>();
    private volatile ChannelBackend activeBackend;

    @PostConstruct
    public void init() {
        ChannelBackendMode mode = properties.getChannel().getMode();
        activeBackend = switch (mode) {
            case FORCE_IN_PROCESS -> inMemoryBackend;
            case FORCE_DISTRIBUTED -> {
                if (!redisBackend.isAvailable()) {
                    throw new IllegalStateException("Channel mode force-distributed requires a reachable Redis");
                }
                yield redisBackend;
            }
            case AUTO -> redisBackend.isAvailable() ? redisBackend : inMemoryBackend;
        };
        log.info("Run channel backend selected: mode={}, backend={}", mode, activeBackend.name());
    }

    public RunChannel getOrCreate(String runId) {
        RunChannel existing = channels.get(runId);
        if (existing != null) {
            return existing;
        }
        ChannelBackend backend = activeBackend();
        try {
            return channels.computeIfAbsent(runId, backend::create);
        } catch (RuntimeException e) {
            if (backend == inMemoryBackend) {
                throw e;
            }
            return degrade(runId, e);
        }
    }

    public RunChannel get(String runId) {
        return channels.get(runId);
    }

    /**
     * 分布式后端故障时切到进程内后端，并替换该 Run 的通道。
     * 强制分布式模式下直接抛出原始异常；线程被中断导致的失败不算后端故障，同样原样抛出。
     */
    public RunChannel degrade(String runId, RuntimeException cause) {
        if (properties.getChannel().getMode() == ChannelBackendMode.FORCE_DISTRIBUTED) {
            throw cause;
        }
        if (isInterruption(cause)) {
            log.info("Channel failure caused by thread interrupt, backend kept: runId={}, backend={}",
                    runId, activeBackend().name());
            throw cause;
        }
        if (activeBackend != inMemoryBackend) {
            log.error("Distributed channel backend failed, falling back to in-memory: runId={}", runId, cause);
            activeBackend = inMemoryBackend;
        }
        RunChannel replacement = channels.compute(runId, (id, current) -> {
            if (current != null && InMemoryRunChannel.BACKEND_NAME.equals(current.backendName())) {
                return current;
            }
            RunChannel created = inMemoryBackend.create(id);
            if (current != null && current.isFinished()) {
                created.markFinished();
            }
            return created;
        });
        log.warn("Run channel replaced by in-memory channel: runId={}", runId);
        return replacement;
    }

    /**
     * 强制结束通道，通道保留到 janitor 回收
     */
    public void cleanup(String runId) {
        RunChannel channel = channels.get(runId);
        if (channel != null) {
            channel.markFinished();
        }
    }

    public void remove(String runId) {
        channels.remove(runId);
    }

    public String activeBackendName() {
        return activeBackend().name();
    }

    public int size() {
        return channels.size();
    }

    @Scheduled(fixedDelayString = "${run-stream.channel.janitor-interval-ms:300000}",
            initialDelayString = "${run-stream.channel.janitor-interval-ms:300000}")
    public void reclaimExpiredChannels() {
        try {
            int reclaimed = reclaim(properties.getChannel().getRetention());
            if (reclaimed > 0) {
                log.info("Run channel janitor reclaimed channels: count={}, remaining={}", reclaimed, channels.size());
            }
        } catch (RuntimeException e) {
            log.error("Run channel janitor failed", e);
        }
    }

    int reclaim(Duration retention) {
        int reclaimed = 0;
        Iterator<Map.Entry<String, RunChannel>> it = channels.entrySet().iterator();
        while (it.hasNext()) {
            RunChannel channel = it.next().getValue();
            if (channel.isFinished() && channel.isDrained() && channel.getAge().compareTo(retention) > 0) {
                it.remove();
                reclaimed++;
                if (log.isDebugEnabled()) {
                    log.debug("Reclaimed run channel: runId={}, backend={}, age={}",
                            channel.getRunId(), channel.backendName(), channel.getAge());
                }
            }
        }
        return reclaimed;
    }

    @PreDestroy
    public void shutdown() {
        // 只结束进程内通道，Redis 上的结束标记由 Run 自身的终止事件写入
        channels.values().stream()
                .filter(channel -> InMemoryRunChannel.BACKEND_NAME.equals(channel.backendName()))
                .forEach(RunChannel::markFinished);
        channels.clear();
        redisBackend.shutdown();
        log.info("Run channel registry shut down");
    }

    private static boolean isInterruption(Throwable cause) {
        return Thread.currentThread().isInterrupted()
                || ExceptionUtils.indexOfType(cause, InterruptedException.class) >= 0;
    }

    private ChannelBackend activeBackend() {
        ChannelBackend backend = activeBackend;
        if (backend == null) {
            synchronized (this) {
                if (activeBackend == null) {
                    init();
                }
                backend = activeBackend;
            }
        }
        return backend;
    }
}
