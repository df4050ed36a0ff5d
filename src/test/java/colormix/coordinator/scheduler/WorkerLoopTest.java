package colormix.coordinator.scheduler;

import colormix.coordinator.config.CoordinatorConfig;
import colormix.coordinator.core.CoordinatorCore;
import colormix.coordinator.messaging.InMemoryMessagingGateway;
import colormix.coordinator.messaging.InMemoryMessagingGateway.PublishedMessage;
import colormix.coordinator.model.ExperimentResult;
import colormix.coordinator.model.SessionToken;
import colormix.coordinator.model.Task;
import colormix.coordinator.model.TaskStatus;
import colormix.coordinator.model.Volumes;
import colormix.coordinator.protocol.CommandEnvelope;
import colormix.coordinator.protocol.DeviceMessages;
import colormix.coordinator.scheduler.WorkerLoop.TickOutcome;
import colormix.coordinator.service.DeviceCommandPublisher;
import colormix.coordinator.service.ResultDispatcher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkerLoopTest {

    private CoordinatorConfig config;
    private CoordinatorCore core;
    private ResultDispatcher dispatcher;
    private InMemoryMessagingGateway bus;
    private WorkerLoop worker;

    @BeforeEach
    void setUp() {
        config = CoordinatorConfig.defaults()
                .withTaskTimeout(Duration.ofMillis(100))
                .withPollInterval(Duration.ofMillis(20));
        core = new CoordinatorCore();
        dispatcher = new ResultDispatcher();
        bus = new InMemoryMessagingGateway();
        bus.connect();
        worker = new WorkerLoop(core, new DeviceCommandPublisher(bus, config), dispatcher, config);
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    private Task enqueue(String sessionId, String well) {
        Task task = Task.builder()
                .token(core.reserveToken(sessionId))
                .volumes(new Volumes(100, 100, 100))
                .well(well)
                .createdAt(Instant.now())
                .build();
        core.enqueue(task);
        return task;
    }

    @Test
    void idleWithEmptyQueue() {
        assertEquals(TickOutcome.IDLE, worker.tick(Instant.now()));
        assertTrue(bus.published().isEmpty());
    }

    @Test
    void startsNextTaskAndSendsMix() {
        Task t = enqueue("s1", "A1");

        assertEquals(TickOutcome.STARTED, worker.tick(Instant.now()));

        assertEquals(TaskStatus.PROCESSING, core.find(t.token()).orElseThrow().status());
        List<PublishedMessage> mixes = bus.publishedTo(config.deviceCommandTopic());
        assertEquals(1, mixes.size());
        CommandEnvelope<Map<String, Object>> cmd = DeviceMessages.parseCommand(mixes.get(0).payload());
        assertEquals("s1", cmd.sessionId());
        assertEquals(t.experimentId(), cmd.experimentId());
        assertEquals("A1", cmd.command().get("well"));
        assertEquals(100, cmd.command().get("B"));
    }

    @Test
    void secondTaskWaitsForFirstToFinish() {
        Task s1 = enqueue("s1", "A1");
        Task s2 = enqueue("s2", "A2");

        worker.tick(Instant.now());
        assertEquals(TickOutcome.BUSY, worker.tick(Instant.now()));
        assertEquals(TaskStatus.PROCESSING, core.find(s1.token()).orElseThrow().status());
        assertEquals(TaskStatus.QUEUED, core.find(s2.token()).orElseThrow().status());

        ExperimentResult done = core.completeActive(s1.token(), Instant.now()).orElseThrow();
        dispatcher.deposit(s1.token(), done);

        assertEquals(TickOutcome.STARTED, worker.tick(Instant.now()));
        assertEquals(TaskStatus.PROCESSING, core.find(s2.token()).orElseThrow().status());
    }

    @Test
    void silentDeviceTimesOutOnce() throws Exception {
        Task s1 = enqueue("s1", "A1");
        worker.tick(Instant.now());

        Thread.sleep(150);
        assertEquals(TickOutcome.TIMED_OUT, worker.tick(Instant.now()));
        assertEquals(TickOutcome.IDLE, worker.tick(Instant.now()));

        assertEquals(TaskStatus.TIMED_OUT, core.find(s1.token()).orElseThrow().status());
        ExperimentResult result = dispatcher.awaitResult(s1.token(), Duration.ofSeconds(1));
        assertEquals(TaskStatus.TIMED_OUT, result.status());
        assertNotNull(result.errorMessage());

        List<PublishedMessage> commands = bus.publishedTo(config.deviceCommandTopic());
        assertEquals(2, commands.size(), "mix and one timeout command");
        CommandEnvelope<Map<String, Object>> timeout = DeviceMessages.parseCommand(commands.get(1).payload());
        assertEquals("sensor_timeout", timeout.command().get("sensor_status"));
        assertEquals(new SessionToken(timeout.sessionId(), timeout.experimentId()), s1.token());
    }

    @Test
    void timeoutNotBeforeBudget() {
        enqueue("s1", "A1");
        Instant start = Instant.now();
        worker.tick(start);

        assertEquals(TickOutcome.BUSY, worker.tick(start.plusMillis(100)));
        assertEquals(TickOutcome.TIMED_OUT, worker.tick(start.plusMillis(101)));
    }

    @Test
    void queuedTaskStartsAfterTimeout() throws Exception {
        enqueue("s1", "A1");
        Task s2 = enqueue("s2", "A2");
        worker.tick(Instant.now());

        Thread.sleep(150);
        worker.tick(Instant.now());
        assertEquals(TaskStatus.QUEUED, core.find(s2.token()).orElseThrow().status());

        assertEquals(TickOutcome.STARTED, worker.tick(Instant.now()));
        assertEquals(TaskStatus.PROCESSING, core.find(s2.token()).orElseThrow().status());
    }

    @Test
    void failedMixPublishErrorsTheTask() throws Exception {
        Task t = enqueue("s1", "A1");
        bus.close();

        assertEquals(TickOutcome.ERRORED, worker.tick(Instant.now()));

        assertTrue(core.active().isEmpty());
        ExperimentResult result = dispatcher.awaitResult(t.token(), Duration.ofSeconds(1));
        assertEquals(TaskStatus.ERRORED, result.status());
        assertTrue(result.errorMessage().startsWith("Mix command could not be sent"));
    }

    @Test
    void runSwallowsTickErrors() {
        WorkerLoop broken = new WorkerLoop(null, null, dispatcher, config);

        assertThrows(NullPointerException.class, () -> broken.tick(Instant.now()));
        assertDoesNotThrow(broken::run);
    }
}
