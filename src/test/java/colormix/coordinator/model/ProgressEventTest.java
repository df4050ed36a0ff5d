package colormix.coordinator.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProgressEventTest {

    private final SessionToken token = new SessionToken("s1", "abcd1234");
    private final Task task = Task.builder()
            .token(token)
            .volumes(new Volumes(100, 100, 100))
            .well("A1")
            .status(TaskStatus.PROCESSING)
            .startedAt(Instant.now())
            .build();

    @Test
    void rejectionIsTerminal() {
        ProgressEvent event = ProgressEvent.rejected(RejectionReason.VOLUME);

        assertEquals(ProgressEvent.Type.REJECTED, event.type());
        assertTrue(event.isTerminal());
        assertNull(event.token());
        assertEquals("Rejected: Volumes out of range", event.message());
    }

    @Test
    void queuedAndRunningAreNotTerminal() {
        ProgressEvent queued = ProgressEvent.queued(token, "A1", 2);
        ProgressEvent running = ProgressEvent.running(token, "A1");

        assertFalse(queued.isTerminal());
        assertFalse(running.isTerminal());
        assertEquals(2, queued.queuePosition());
        assertEquals("Queued in well A1 at position 2", queued.message());
    }

    @Test
    void finishedMapsResultStatus() {
        Instant now = Instant.now();

        ProgressEvent completed = ProgressEvent.finished(ExperimentResult.completed(task, Map.of("ch410", 100), now));
        ProgressEvent timedOut = ProgressEvent.finished(ExperimentResult.timedOut(task, "late", now));
        ProgressEvent errored = ProgressEvent.finished(ExperimentResult.errored(task, "broken", now));

        assertEquals(ProgressEvent.Type.COMPLETED, completed.type());
        assertEquals(ProgressEvent.Type.TIMED_OUT, timedOut.type());
        assertEquals(ProgressEvent.Type.ERRORED, errored.type());
        assertEquals("Failed: late", timedOut.message());
        assertTrue(completed.isTerminal());
    }

    @Test
    void resultRequiresTerminalStatus() {
        assertThrows(IllegalArgumentException.class, () -> new ExperimentResult(token, TaskStatus.PROCESSING,
                task.volumes(), "A1", Map.of(), null, null, null));
    }
}
