package com.agentrelay.core.engine;

import com.agentrelay.core.aggregate.FarmInventoryMerger;
import com.agentrelay.core.aggregate.LogisticsTimelineMerger;
import com.agentrelay.core.aggregate.NewsDigestMerger;
import com.agentrelay.core.aggregate.ReplyParser;
import com.agentrelay.core.aggregate.ResponseBuilder;
import com.agentrelay.core.config.RelayProperties;
import com.agentrelay.core.dispatch.FixedBackoffPolicy;
import com.agentrelay.core.events.EventBus;
import com.agentrelay.core.events.RunEvent;
import com.agentrelay.core.events.RunEventType;
import com.agentrelay.core.metrics.RelayMetrics;
import com.agentrelay.core.model.AggregatedResult;
import com.agentrelay.core.model.AggregationPolicy;
import com.agentrelay.core.model.FailureKind;
import com.agentrelay.core.model.RunMode;
import com.agentrelay.core.model.RunOutcome;
import com.agentrelay.core.model.RunState;
import com.agentrelay.core.model.Task;
import com.agentrelay.core.model.TaskResult;
import com.agentrelay.core.model.TaskStatus;
import com.agentrelay.core.model.TaskTarget;
import com.agentrelay.core.routing.CompositeRequestDecomposer;
import com.agentrelay.core.routing.Decomposition;
import com.agentrelay.core.routing.FarmRequestDecomposer;
import com.agentrelay.core.routing.LogisticsRequestDecomposer;
import com.agentrelay.core.routing.NewsRequestDecomposer;
import com.agentrelay.core.routing.RequestDecomposer;
import com.agentrelay.core.routing.SupervisorRequest;
import com.agentrelay.core.routing.TaskSpec;
import com.agentrelay.workers.LogisticsAgent;
import com.agentrelay.workers.WorkerDirectory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Stream;

import static com.agentrelay.core.engine.ScriptedTransport.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

/**
 * Scenario tests for {@link Supervisor} against a scripted transport.
 */
class SupervisorTest {

    private static final List<String> FARMS = List.of("brazil", "colombia", "vietnam");

    private WorkerDirectory directory;
    private RelayProperties properties;
    private EventBus eventBus;
    private SimpleMeterRegistry registry;
    private Supervisor supervisor;

    @BeforeEach
    void setUp() {
        directory = new WorkerDirectory()
                .register(WorkerDirectory.FARM, FARMS)
                .register(WorkerDirectory.LOGISTICS, List.of("tatooine", "shipper", "accountant"))
                .register(WorkerDirectory.SCRAPER, List.of("scraper-1", "scraper-2"));
        properties = new RelayProperties();
        properties.getDispatch().setTaskTimeoutMs(150);
        properties.getDispatch().setRetryDelayMs(10);
        properties.getDispatch().setStaggerDelayMs(0);
        properties.getDispatch().setRunDeadlineMs(5_000);
        eventBus = new EventBus();
        registry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        if (supervisor != null) {
            supervisor.shutdown();
        }
    }

    private Supervisor supervisor(ScriptedTransport transport, Set<String> denied) {
        return supervisor(transport, denied, defaultDecomposer());
    }

    private Supervisor supervisor(ScriptedTransport transport, Set<String> denied, RequestDecomposer decomposer) {
        var parser = new ReplyParser();
        var builder = new ResponseBuilder(List.of(new FarmInventoryMerger(parser),
                new LogisticsTimelineMerger(parser), new NewsDigestMerger()), parser);
        supervisor = new Supervisor(decomposer, transport, worker -> !denied.contains(worker), builder,
                new FixedBackoffPolicy(properties.getRetryDelay()), properties, eventBus,
                new RelayMetrics(registry));
        return supervisor;
    }

    private RequestDecomposer defaultDecomposer() {
        return new CompositeRequestDecomposer(List.of(
                new NewsRequestDecomposer(directory),
                new LogisticsRequestDecomposer(directory),
                new FarmRequestDecomposer(directory)));
    }

    /** Broadcast of {@code payload} to every farm, bypassing prompt routing. */
    private static RequestDecomposer broadcastToFarms(String payload) {
        return request -> Decomposition.broadcast(WorkerDirectory.FARM, AggregationPolicy.TOLERATE_PARTIAL,
                FARMS.stream()
                        .map(f -> new TaskSpec(TaskTarget.broadcast(FarmRequestDecomposer.BROADCAST_GROUP, f, FARMS),
                                payload))
                        .toList());
    }

    // -- Scenarios ---------------------------------------------------------------

    @Nested
    @DisplayName("scenarios")
    class Scenarios {

        @Test
        @DisplayName("unicast success returns the worker's reply verbatim")
        void unicastSuccess() {
            var transport = new ScriptedTransport(workerError("unexpected"))
                    .script("colombia", reply("5000 lbs"));
            supervisor(transport, Set.of());

            AggregatedResult result = supervisor.run(
                    SupervisorRequest.of("How much coffee does the Colombia farm have?"), "S-1");

            assertEquals(RunOutcome.COMPLETED, result.outcome());
            assertEquals("5000 lbs", result.response());
            assertEquals("S-1", result.runId());
            assertEquals(1, result.tasks().size());
            assertEquals("colombia", result.tasks().get(0).worker());
            assertEquals("S-1/TASK-001", result.tasks().get(0).taskId());
            assertEquals(1, transport.published.size());
        }

        @Test
        @DisplayName("timed-out first attempt is retried and the second attempt succeeds")
        void unicastRetryThenSuccess() {
            var transport = new ScriptedTransport(workerError("unexpected"))
                    .script("brazil", hold(), reply("order_id: 54321"));
            supervisor(transport, Set.of());

            AggregatedResult result = supervisor.run(SupervisorRequest.of(
                    "Create an order with price 2.5 and quantity 100 from the Brazil farm"), null);

            assertEquals(RunOutcome.COMPLETED, result.outcome());
            assertEquals("order_id: 54321", result.response());
            TaskResult task = result.tasks().get(0);
            assertEquals(2, task.attempt());
            assertEquals("54321", task.orderId());
            assertEquals(2, transport.publishedTo("brazil"));
            assertEquals("Create an order with price 2.5 and quantity 100", transport.published.get(0).payload());
            assertEquals(1.0, registry.find("agentrelay.dispatch.retries").tag("reason", "TIMEOUT")
                    .counter().count());
        }

        @Test
        @DisplayName("broadcast tolerates an unauthorized farm and merges the others")
        void broadcastPartialFailure() {
            var transport = new ScriptedTransport(workerError("unexpected"))
                    .script("colombia", reply("5000 lbs"))
                    .script("vietnam", reply("6200 lbs"));
            supervisor(transport, Set.of("brazil"));

            RunHandle handle = supervisor.submit(
                    SupervisorRequest.of("Show total inventory across all farms"), RunMode.SYNCHRONOUS, null);
            AggregatedResult result = supervisor.await(handle);

            assertEquals(RunOutcome.COMPLETED_PARTIAL, result.outcome());
            assertEquals(RunState.COMPLETE, handle.state());
            assertEquals(List.of("colombia", "vietnam"),
                    result.succeeded().stream().map(TaskResult::worker).toList());
            assertTrue(result.response().contains("colombia : 5000 lbs"));
            assertTrue(result.response().contains("vietnam : 6200 lbs"));
            assertTrue(result.response().contains("Total: 11200 lbs"));
            assertFalse(result.response().contains("brazil :"));
            assertTrue(result.response().contains("- brazil (attempts: 0): Worker 'brazil' is not authorized"));

            TaskResult brazil = result.failed().get(0);
            assertEquals(TaskStatus.FAILED, brazil.status());
            assertEquals(FailureKind.UNAUTHORIZED, brazil.failureKind());
            assertEquals(0, transport.publishedTo("brazil"));
        }

        @Test
        @DisplayName("every farm failing delivery yields ALL_TASKS_FAILED and an ERROR run")
        void fullFailure() {
            var transport = new ScriptedTransport(rejectDelivery("transport outage"));
            supervisor(transport, Set.of());

            RunHandle handle = supervisor.submit(
                    SupervisorRequest.of("Show total inventory across all farms"), RunMode.SYNCHRONOUS, null);
            AggregatedResult result = supervisor.await(handle);

            assertEquals(RunOutcome.ALL_TASKS_FAILED, result.outcome());
            assertTrue(result.isError());
            assertEquals(RunState.ERROR, handle.state());
            assertEquals(9, transport.published.size());
            assertTrue(result.tasks().stream().allMatch(t -> t.failureKind() == FailureKind.DELIVERY_FAILURE));
            assertTrue(result.response().startsWith("Error: all 3 tasks failed."));
        }

        @Test
        @DisplayName("streaming logistics run emits one event per task plus one final event")
        void streamingLogistics() {
            var transport = new ScriptedTransport(agent(new LogisticsAgent("Participant")));
            supervisor(transport, Set.of(), new LogisticsRequestDecomposer(directory, () -> "ORD42"));

            RunHandle handle = supervisor.submit(
                    SupervisorRequest.of("Ship 100 lbs of coffee to the market"), RunMode.STREAMING, "S-LOG");
            List<RunEvent> events;
            try (Stream<RunEvent> stream = supervisor.stream(handle)) {
                events = stream.toList();
            }

            assertEquals(handle.taskIds().size() + 1, events.size());
            assertEquals(5, handle.taskIds().size());
            assertTrue(events.subList(0, 5).stream().allMatch(e -> e.type() == RunEventType.TASK_COMPLETED));
            RunEvent last = events.get(5);
            assertTrue(last.isFinal());
            assertEquals("S-LOG", last.runId());
            assertEquals(RunOutcome.COMPLETED, last.result().outcome());
            assertTrue(last.result().response().startsWith("Order ORD42 timeline:"));
            assertTrue(events.stream().allMatch(e -> "S-LOG".equals(e.runId())));
        }

        @Test
        @DisplayName("streaming runs read their events through a per-run event bus subscription")
        void streamingSubscribesPerRun() {
            eventBus = spy(new EventBus());
            var transport = new ScriptedTransport(agent(new LogisticsAgent("Participant")));
            supervisor(transport, Set.of(), new LogisticsRequestDecomposer(directory, () -> "ORD7"));

            RunHandle sync = supervisor.submit(
                    SupervisorRequest.of("Ship 100 lbs of coffee to the market"), RunMode.SYNCHRONOUS, "S-SYNC");
            supervisor.await(sync);
            verify(eventBus, never()).subscribe(anyString(), any());

            RunHandle streaming = supervisor.submit(
                    SupervisorRequest.of("Ship 100 lbs of coffee to the market"), RunMode.STREAMING, "S-SUB");
            long streamed = supervisor.stream(streaming).count();

            verify(eventBus).subscribe(eq("S-SUB"), any());
            assertEquals(streaming.taskIds().size() + 1, streamed);
        }

        @Test
        @DisplayName("run deadline forces a partial result and late replies are ignored")
        void deadline() throws InterruptedException {
            properties.getDispatch().setTaskTimeoutMs(10_000);
            properties.getDispatch().setRunDeadlineMs(300);
            var transport = new ScriptedTransport(hold());
            supervisor(transport, Set.of());

            RunHandle handle = supervisor.submit(
                    SupervisorRequest.of("How much coffee does the Colombia farm have?"), RunMode.SYNCHRONOUS, null);
            AggregatedResult result = supervisor.await(handle);

            assertEquals(RunOutcome.DEADLINE_EXCEEDED, result.outcome());
            assertTrue(result.partial());
            assertTrue(result.response().startsWith("Error: run deadline exceeded"));
            TaskResult task = result.tasks().get(0);
            assertEquals(TaskStatus.TIMED_OUT, task.status());
            assertEquals(FailureKind.RUN_DEADLINE, task.failureKind());

            transport.replyTo(handle.taskIds().get(0), "5000 lbs");
            Task after = handle.tasks().get(0);
            assertEquals(TaskStatus.TIMED_OUT, after.status());
            assertNull(after.result());
            assertEquals(0, supervisor.activeRunCount());
        }
    }

    // -- Properties ----------------------------------------------------------------

    @Nested
    @DisplayName("dispatch properties")
    class DispatchProperties {

        @Test
        @DisplayName("a task is dispatched at most maxAttempts times")
        void retryBound() {
            properties.getDispatch().setMaxAttempts(2);
            properties.getDispatch().setTaskTimeoutMs(50);
            var transport = new ScriptedTransport(hold());
            supervisor(transport, Set.of());

            AggregatedResult result = supervisor.run(
                    SupervisorRequest.of("How much coffee does the Colombia farm have?"), null);

            assertEquals(2, transport.published.size());
            assertEquals(RunOutcome.ALL_TASKS_FAILED, result.outcome());
            TaskResult task = result.tasks().get(0);
            assertEquals(TaskStatus.TIMED_OUT, task.status());
            assertEquals(FailureKind.TIMEOUT, task.failureKind());
            assertEquals(2, task.attempt());
            assertTrue(result.response().contains("failed after 2 attempts"));
        }

        @Test
        @DisplayName("worker errors are retried like timeouts")
        void workerErrorRetried() {
            var transport = new ScriptedTransport(workerError("unexpected"))
                    .script("colombia", workerError("busy"), reply("5000 lbs"));
            supervisor(transport, Set.of());

            AggregatedResult result = supervisor.run(
                    SupervisorRequest.of("How much coffee does the Colombia farm have?"), null);

            assertEquals(RunOutcome.COMPLETED, result.outcome());
            assertEquals(2, result.tasks().get(0).attempt());
        }

        @Test
        @DisplayName("duplicate reply for a succeeded task changes nothing and emits no second event")
        void atMostOnce() throws InterruptedException {
            properties.getDispatch().setTaskTimeoutMs(10_000);
            List<RunEvent> seen = new CopyOnWriteArrayList<>();
            eventBus.subscribeAll(seen::add);
            var transport = new ScriptedTransport(hold());
            supervisor(transport, Set.of(), broadcastToFarms("inventory"));

            RunHandle handle = supervisor.submit(SupervisorRequest.of("inventory"), RunMode.SYNCHRONOUS, null);
            transport.awaitPublished(3);
            String colombia = handle.taskIds().get(1);
            transport.replyTo(colombia, "5000 lbs");
            transport.replyTo(colombia, "9999 lbs");
            transport.replyTo(handle.taskIds().get(0), "7500 lbs");
            transport.replyTo(handle.taskIds().get(2), "6200 lbs");
            AggregatedResult result = supervisor.await(handle);

            assertEquals("5000 lbs", result.tasks().get(1).result());
            long completions = seen.stream()
                    .filter(e -> e.type() == RunEventType.TASK_COMPLETED && colombia.equals(e.taskId()))
                    .count();
            assertEquals(1, completions);
            assertEquals(1.0, registry.find("agentrelay.replies.discarded").counter().count());
        }

        @Test
        @DisplayName("stream events follow completion order, not dispatch order")
        void streamingCompletionOrder() throws InterruptedException {
            properties.getDispatch().setTaskTimeoutMs(10_000);
            var transport = new ScriptedTransport(hold());
            supervisor(transport, Set.of(), broadcastToFarms("inventory"));

            RunHandle handle = supervisor.submit(SupervisorRequest.of("inventory"), RunMode.STREAMING, null);
            List<String> ids = handle.taskIds();
            transport.awaitPublished(3);
            transport.replyTo(ids.get(2), "6200 lbs");
            transport.replyTo(ids.get(0), "7500 lbs");
            transport.replyTo(ids.get(1), "5000 lbs");

            List<RunEvent> events = supervisor.stream(handle).toList();
            assertEquals(List.of(ids.get(2), ids.get(0), ids.get(1)),
                    events.subList(0, 3).stream().map(RunEvent::taskId).toList());
            assertEquals(4, events.size());
            assertEquals(1, events.stream().filter(RunEvent::isFinal).count());
        }

        @Test
        @DisplayName("broadcast dispatches are staggered by the run-level delay")
        void staggeredDispatch() {
            properties.getDispatch().setStaggerDelayMs(100);
            var transport = new ScriptedTransport(reply("1 lbs"));
            supervisor(transport, Set.of(), broadcastToFarms("inventory"));

            supervisor.run(SupervisorRequest.of("inventory"), null);

            List<Long> times = transport.publishedAtNanos;
            assertEquals(3, times.size());
            assertTrue(Duration.ofNanos(times.get(2) - times.get(0)).toMillis() >= 150);
        }
    }

    // -- Caller contract -------------------------------------------------------------

    @Nested
    @DisplayName("caller contract")
    class CallerContract {

        @Test
        @DisplayName("blank prompt is rejected without dispatching")
        void blankPrompt() {
            var transport = new ScriptedTransport(reply("x"));
            supervisor(transport, Set.of());

            assertThrows(InvalidRequestException.class,
                    () -> supervisor.submit(SupervisorRequest.of("   "), RunMode.SYNCHRONOUS, null));
            assertTrue(transport.published.isEmpty());
        }

        @Test
        @DisplayName("prompt with no targets is an invalid request, distinct from all-failed")
        void noTargets() {
            var transport = new ScriptedTransport(reply("x"));
            supervisor(transport, Set.of());

            var e = assertThrows(InvalidRequestException.class,
                    () -> supervisor.submit(SupervisorRequest.of("Tell me a joke"), RunMode.SYNCHRONOUS, null));
            assertEquals(CompositeRequestDecomposer.NO_TARGETS, e.getMessage());
            assertTrue(transport.published.isEmpty());
        }

        @Test
        @DisplayName("stream can be taken once and only for streaming runs")
        void streamSingleUse() {
            var transport = new ScriptedTransport(reply("5000 lbs"));
            supervisor(transport, Set.of());

            RunHandle streaming = supervisor.submit(
                    SupervisorRequest.of("How much coffee does the Colombia farm have?"), RunMode.STREAMING, null);
            assertEquals(2, supervisor.stream(streaming).count());
            assertThrows(IllegalStateException.class, () -> supervisor.stream(streaming));

            RunHandle sync = supervisor.submit(
                    SupervisorRequest.of("How much coffee does the Colombia farm have?"), RunMode.SYNCHRONOUS, null);
            assertThrows(IllegalStateException.class, () -> supervisor.stream(sync));
            supervisor.await(sync);
        }

        @Test
        @DisplayName("a session id cannot start a second run while the first is active")
        void duplicateSession() {
            properties.getDispatch().setTaskTimeoutMs(10_000);
            var transport = new ScriptedTransport(hold());
            supervisor(transport, Set.of());

            supervisor.submit(SupervisorRequest.of("How much coffee does the Colombia farm have?"),
                    RunMode.SYNCHRONOUS, "S-DUP");
            assertThrows(InvalidRequestException.class,
                    () -> supervisor.submit(SupervisorRequest.of("How much coffee does the Brazil farm have?"),
                            RunMode.SYNCHRONOUS, "S-DUP"));
        }

        @Test
        @DisplayName("concurrent runs keep separate dispatch tables")
        void concurrentRuns() throws InterruptedException {
            properties.getDispatch().setTaskTimeoutMs(10_000);
            var transport = new ScriptedTransport(hold());
            supervisor(transport, Set.of());

            RunHandle a = supervisor.submit(SupervisorRequest.of("How much coffee does the Colombia farm have?"),
                    RunMode.SYNCHRONOUS, "S-A");
            RunHandle b = supervisor.submit(SupervisorRequest.of("How much coffee does the Vietnam farm have?"),
                    RunMode.SYNCHRONOUS, "S-B");
            transport.awaitPublished(2);
            assertEquals(2, supervisor.activeRunCount());

            transport.replyTo("S-B/TASK-001", "6200 lbs");
            transport.replyTo("S-A/TASK-001", "5000 lbs");

            assertEquals("5000 lbs", supervisor.await(a).response());
            assertEquals("6200 lbs", supervisor.await(b).response());
            assertEquals(0, supervisor.activeRunCount());
        }
    }
}
