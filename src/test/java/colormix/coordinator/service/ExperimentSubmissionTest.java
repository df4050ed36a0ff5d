package colormix.coordinator.service;

import colormix.coordinator.model.ExperimentResult;
import colormix.coordinator.model.ProgressEvent;
import colormix.coordinator.model.RejectionReason;
import colormix.coordinator.model.SessionToken;
import colormix.coordinator.model.TaskStatus;
import colormix.coordinator.model.Volumes;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class ExperimentSubmissionTest {

    private static final SessionToken TOKEN = new SessionToken("s1", "abcd1234");

    @Test
    void rejectedIsTerminalImmediately() throws Exception {
        ExperimentSubmission s = ExperimentSubmission.rejected(RejectionReason.NO_WELLS);

        assertTrue(s.isRejected());
        assertNull(s.token());
        assertTrue(s.isFinished());
        assertEquals(ProgressEvent.Type.REJECTED, s.first().type());
        assertEquals(RejectionReason.NO_WELLS, s.awaitTerminal(Duration.ZERO).rejection());
    }

    @Test
    void eventsArriveInOrder() throws Exception {
        ExperimentSubmission s = new ExperimentSubmission(TOKEN);
        s.emit(ProgressEvent.queued(TOKEN, "A1", 2));
        s.emit(ProgressEvent.running(TOKEN, "A1"));

        assertEquals(ProgressEvent.Type.QUEUED, s.next(Duration.ofMillis(10)).type());
        assertEquals(ProgressEvent.Type.RUNNING, s.next(Duration.ofMillis(10)).type());
        assertNull(s.next(Duration.ofMillis(10)));
        assertFalse(s.isFinished());
        assertThrows(TimeoutException.class, () -> s.awaitTerminal(Duration.ofMillis(10)));
    }

    @Test
    void nothingAfterTerminal() throws Exception {
        ExperimentSubmission s = new ExperimentSubmission(TOKEN);
        s.emit(ProgressEvent.queued(TOKEN, "A1", 1));
        ExperimentResult result = new ExperimentResult(TOKEN, TaskStatus.COMPLETED, new Volumes(1, 2, 3), "A1",
                Map.of(), null, Instant.now(), Instant.now());
        s.emit(ProgressEvent.finished(result));

        assertEquals(ProgressEvent.Type.COMPLETED, s.awaitTerminal(Duration.ofMillis(10)).type());
        assertThrows(IllegalStateException.class, () -> s.emit(ProgressEvent.running(TOKEN, "A1")));
        assertEquals(2, s.events().size());
        assertEquals(ProgressEvent.Type.QUEUED, s.first().type());
    }
}
