package colormix.coordinator.integration;

import colormix.coordinator.config.CoordinatorConfig;
import colormix.coordinator.config.Dependencies;
import colormix.coordinator.messaging.InMemoryMessagingGateway;
import colormix.coordinator.messaging.InMemoryMessagingGateway.PublishedMessage;
import colormix.coordinator.model.ExperimentResult;
import colormix.coordinator.model.ProgressEvent;
import colormix.coordinator.model.RejectionReason;
import colormix.coordinator.model.TaskStatus;
import colormix.coordinator.model.Volumes;
import colormix.coordinator.protocol.CommandEnvelope;
import colormix.coordinator.protocol.DeviceMessages;
import colormix.coordinator.service.ExperimentSubmission;
import colormix.coordinator.simulation.SimulatedDevice;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end flow against the in-memory bus and the simulated device:
 * 1. Submit experiments
 * 2. Worker loop sends the mix command
 * 3. Device reports in_place, sensor data, charging
 * 4. Result reaches the submitter and the result table
 */
class FullFlowIntegrationTest {

        private static final Duration WAIT = Duration.ofSeconds(10);

        private Dependencies deps;
        private InMemoryMessagingGateway bus;
        private SimulatedDevice device;

        private void start(Duration taskTimeout) {
                CoordinatorConfig config = CoordinatorConfig.defaults()
                                .withDatabaseUrl("jdbc:h2:mem:test-flow-" + System.nanoTime()
                                                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                                .withPlate("AB", 3)
                                .withPollInterval(Duration.ofMillis(20))
                                .withSimulatedDeviceDelay(Duration.ofMillis(20))
                                .withTaskTimeout(taskTimeout);
                bus = new InMemoryMessagingGateway();
                deps = Dependencies.create(config, bus);
                deps.seedPlateIfEmpty();
                device = deps.simulationService().start();
                deps.connectGateway();
                deps.startScheduler();
        }

        @AfterEach
        void tearDown() {
                if (deps != null) {
                        deps.close();
                }
        }

        @Test
        @DisplayName("Submit, mix, read, complete: result reaches submitter and storage")
        void testSingleExperiment() throws Exception {
                start(Duration.ofSeconds(5));

                ExperimentSubmission s = deps.admissionService().submit("s1", 100, 100, 100);

                ProgressEvent queued = s.first();
                assertEquals(ProgressEvent.Type.QUEUED, queued.type());
                assertEquals("A1", queued.well());

                ProgressEvent done = s.awaitTerminal(WAIT);
                assertEquals(ProgressEvent.Type.COMPLETED, done.type());
                List<ProgressEvent.Type> types = s.events().stream().map(ProgressEvent::type).toList();
                assertEquals(List.of(ProgressEvent.Type.QUEUED, ProgressEvent.Type.RUNNING,
                                ProgressEvent.Type.COMPLETED), types);

                ExperimentResult result = done.result();
                assertEquals(new Volumes(100, 100, 100), result.volumes());
                assertEquals("A1", result.well());
                assertEquals(8, result.sensorData().size());
                assertEquals(1, device.mixCount());

                Optional<ExperimentResult> stored = Optional.empty();
                long deadline = System.currentTimeMillis() + 2000;
                while (stored.isEmpty() && System.currentTimeMillis() < deadline) {
                        Thread.sleep(20);
                        stored = deps.resultRepository().findByToken(s.token());
                }
                assertTrue(stored.isPresent(), "result should be persisted");
                assertEquals(TaskStatus.COMPLETED, stored.get().status());
                assertEquals(5, deps.wellPool().countUnused());
        }

        @Test
        @DisplayName("Two submissions run strictly one after the other")
        void testFifoOrder() throws Exception {
                start(Duration.ofSeconds(5));

                ExperimentSubmission s1 = deps.admissionService().submit("s1", 10, 20, 30);
                ExperimentSubmission s2 = deps.admissionService().submit("s2", 30, 20, 10);
                assertEquals(2, s2.first().queuePosition());

                ExperimentResult r1 = s1.awaitTerminal(WAIT).result();
                ExperimentResult r2 = s2.awaitTerminal(WAIT).result();

                assertEquals(TaskStatus.COMPLETED, r1.status());
                assertEquals(TaskStatus.COMPLETED, r2.status());
                assertFalse(r2.startedAt().isBefore(r1.finishedAt()),
                                "s2 must not start before s1 finished");
                assertEquals("A2", r2.well());
        }

        @Test
        @DisplayName("Silent device: task times out and the device is told once")
        void testTimeout() throws Exception {
                start(Duration.ofMillis(300));
                device.setSilent(true);

                ExperimentSubmission s = deps.admissionService().submit("s1", 50, 50, 50);
                ProgressEvent done = s.awaitTerminal(WAIT);

                assertEquals(ProgressEvent.Type.TIMED_OUT, done.type());
                assertNotNull(done.result().errorMessage());

                bus.awaitDelivery(1000);
                List<PublishedMessage> timeouts = bus.publishedTo(deps.config().deviceCommandTopic()).stream()
                                .filter(m -> m.payload().contains("sensor_timeout"))
                                .toList();
                assertEquals(1, timeouts.size());
                CommandEnvelope<Map<String, Object>> cmd = DeviceMessages.parseCommand(timeouts.get(0).payload());
                assertEquals(s.token().sessionId(), cmd.sessionId());
                assertEquals(s.token().experimentId(), cmd.experimentId());
                assertEquals(1, device.timeoutCount());
        }

        @Test
        @DisplayName("Queue moves on after a timed out task")
        void testQueueContinuesAfterTimeout() throws Exception {
                start(Duration.ofMillis(300));
                device.setSilent(true);

                ExperimentSubmission s1 = deps.admissionService().submit("s1", 50, 50, 50);
                ExperimentSubmission s2 = deps.admissionService().submit("s2", 50, 50, 50);

                ExperimentResult r1 = s1.awaitTerminal(WAIT).result();
                ExperimentResult r2 = s2.awaitTerminal(WAIT).result();

                assertEquals(TaskStatus.TIMED_OUT, r1.status());
                assertEquals(TaskStatus.TIMED_OUT, r2.status());
                assertFalse(r2.startedAt().isBefore(r1.finishedAt()));
                assertEquals(2, device.mixCount());
        }

        @Test
        @DisplayName("Rejected submissions never reach the device")
        void testRejections() {
                start(Duration.ofSeconds(5));

                ExperimentSubmission s = deps.admissionService().submit("s1", 200, 150, 0);

                assertTrue(s.isRejected());
                assertEquals(RejectionReason.VOLUME, s.first().rejection());
                assertEquals(6, deps.wellPool().countUnused());
                assertTrue(deps.taskService().queuedTokens().isEmpty());
                assertTrue(deps.taskService().activeTask().isEmpty());
        }
}
