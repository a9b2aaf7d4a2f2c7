package world.willfrog.stream.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import world.willfrog.agentstream.common.model.RawEvent;
import world.willfrog.agentstream.common.model.RunStatus;
import world.willfrog.stream.entity.RunEvent;
import world.willfrog.stream.model.StreamRun;
import world.willfrog.stream.support.RunStreamFixture;

import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunExecutionServiceTest {

    private static final Duration SETTLE_TIMEOUT = Duration.ofSeconds(5);

    private RunStreamFixture fixture;
    private ExecutorService executor;
    private RunExecutionService executionService;

    @BeforeEach
    void setUp() {
        fixture = new RunStreamFixture();
        executor = Executors.newFixedThreadPool(2);
        executionService = new RunExecutionService(fixture.streamService, fixture.taskRegistry, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void start_shouldAppendSuccessEndWhenEngineOmitsIt() throws Exception {
        RunTaskHandle handle = executionService.start(StreamRun.of("r1"),
                run -> List.of(RawEvent.values(1), RawEvent.updates(Map.of("agent", 2))).iterator());

        assertTrue(handle.awaitSettled(SETTLE_TIMEOUT));
        assertEquals(List.of("values", "updates", "end"), storedTypes("r1"));
        assertEquals(Optional.of(RunStatus.SUCCESS), fixture.streamService.resolveFinalStatus("r1"));
        assertFalse(fixture.taskRegistry.isActive("r1"));
    }

    @Test
    void start_shouldKeepEngineTerminalAndStopThere() throws Exception {
        RunTaskHandle handle = executionService.start(StreamRun.of("r1"), run -> List.of(
                RawEvent.values(1),
                RawEvent.end(RunStatus.SUCCESS, Map.of("answer", 42)),
                RawEvent.values("after-end")).iterator());

        assertTrue(handle.awaitSettled(SETTLE_TIMEOUT));
        assertEquals(List.of("values", "end"), storedTypes("r1"));
    }

    @Test
    void start_shouldRecordEngineFailure() throws Exception {
        RunTaskHandle handle = executionService.start(StreamRun.of("r1"), run -> new Iterator<>() {
            private boolean emitted;

            @Override
            public boolean hasNext() {
                return true;
            }

            @Override
            public RawEvent next() {
                if (!emitted) {
                    emitted = true;
                    return RawEvent.values(1);
                }
                throw new IllegalArgumentException("bad tool input");
            }
        });

        assertTrue(handle.awaitSettled(SETTLE_TIMEOUT));
        List<RunEvent> events = fixture.eventStore.getAllEvents("r1");
        assertEquals(List.of("values", "error", "end"), storedTypes("r1"));
        Map<String, Object> error = fixture.eventStore.readData(events.get(1));
        assertEquals("IllegalArgumentException", error.get("error"));
        assertEquals("bad tool input", error.get("message"));
        assertEquals(Optional.of(RunStatus.ERROR), fixture.streamService.resolveFinalStatus("r1"));
    }

    @Test
    void cancelRun_shouldWinOverLateEngineEvents() throws Exception {
        CountDownLatch firstEmitted = new CountDownLatch(1);
        BlockingSource source = new BlockingSource(firstEmitted);
        executionService.start(StreamRun.of("r1"), source);
        assertTrue(firstEmitted.await(5, TimeUnit.SECONDS));

        boolean wasRunning = fixture.streamService.cancelRun("r1", true);

        assertTrue(wasRunning);
        assertFalse(fixture.taskRegistry.isActive("r1"));
        List<String> types = storedTypes("r1");
        assertEquals("end", types.get(types.size() - 1));
        assertEquals(1, types.stream().filter("end"::equals).count());
        assertEquals(Optional.of(RunStatus.INTERRUPTED), fixture.streamService.resolveFinalStatus("r1"));
        assertFalse(fixture.streamService.isRunStreaming("r1"));
    }

    @Test
    void cancelRun_shouldBeIdempotent() throws Exception {
        CountDownLatch firstEmitted = new CountDownLatch(1);
        executionService.start(StreamRun.of("r1"), new BlockingSource(firstEmitted));
        assertTrue(firstEmitted.await(5, TimeUnit.SECONDS));

        fixture.streamService.cancelRun("r1", true);
        fixture.streamService.cancelRun("r1", true);
        fixture.streamService.cancelRun("r1", false);

        assertEquals(1, storedTypes("r1").stream().filter("end"::equals).count());
        assertEquals(Optional.of(RunStatus.INTERRUPTED), fixture.streamService.resolveFinalStatus("r1"));
    }

    @Test
    void interruptRun_shouldEndWithError() throws Exception {
        CountDownLatch firstEmitted = new CountDownLatch(1);
        executionService.start(StreamRun.of("r1"), new BlockingSource(firstEmitted));
        assertTrue(firstEmitted.await(5, TimeUnit.SECONDS));

        fixture.streamService.interruptRun("r1", true);

        assertEquals(List.of("values", "error", "end"), storedTypes("r1"));
        assertEquals(Optional.of(RunStatus.ERROR), fixture.streamService.resolveFinalStatus("r1"));
    }

    private List<String> storedTypes(String runId) {
        return fixture.eventStore.getAllEvents(runId).stream().map(RunEvent::getEventType).collect(Collectors.toList());
    }

    /**
     * 产出一条事件后阻塞，直到线程被中断；中断后继续吐出迟到事件和 end(success)。
     */
    private static final class BlockingSource implements RunEventSource {

        private final CountDownLatch firstEmitted;

        private BlockingSource(CountDownLatch firstEmitted) {
            this.firstEmitted = firstEmitted;
        }

        @Override
        public Iterator<RawEvent> stream(StreamRun run) {
            return new Iterator<>() {
                private int step;

                @Override
                public boolean hasNext() {
                    if (step == 1) {
                        firstEmitted.countDown();
                        try {
                            Thread.sleep(10_000);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                    }
                    return step < 3;
                }

                @Override
                public RawEvent next() {
                    step++;
                    return switch (step) {
                        case 1 -> RawEvent.values("first");
                        case 2 -> RawEvent.values("late");
                        case 3 -> RawEvent.end(RunStatus.SUCCESS, null);
                        default -> throw new NoSuchElementException();
                    };
                }
            };
        }
    }
}
