package org.multibench.matrix;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.multibench.plan.RunConfiguration;

class RunInstanceTest {
    private static final RunConfiguration CONFIG = RunConfiguration.of(Map.of(), "", "./app");

    @Test
    void followsTheSubmissionLifecycle() {
        RunInstance instance = new RunInstance("b", Map.of("n", "1"), CONFIG, 0);

        assertFalse(instance.hasLiveJob());
        instance.markSubmitted("42");
        assertEquals(RunStatus.SUBMITTED, instance.status());
        assertEquals(Optional.of("42"), instance.jobId());
        assertTrue(instance.hasLiveJob());

        assertTrue(instance.tryTransitionTo(RunStatus.RUNNING));
        assertFalse(instance.tryTransitionTo(RunStatus.RUNNING));
        assertTrue(instance.tryTransitionTo(RunStatus.COMPLETED));
        assertFalse(instance.hasLiveJob());
    }

    @Test
    void terminalStatusIsFinal() {
        RunInstance instance = new RunInstance("b", Map.of(), CONFIG, 0);
        instance.markSubmitted("7");
        instance.transitionTo(RunStatus.FAILED);

        assertFalse(instance.tryTransitionTo(RunStatus.COMPLETED));
        assertThrows(IllegalStateException.class, () -> instance.transitionTo(RunStatus.RUNNING));
        assertEquals(RunStatus.FAILED, instance.status());
    }

    @Test
    void pendingCannotJumpToRunningOrCompleted() {
        RunInstance instance = new RunInstance("b", Map.of(), CONFIG, 0);

        assertFalse(instance.tryTransitionTo(RunStatus.RUNNING));
        assertFalse(instance.tryTransitionTo(RunStatus.COMPLETED));
        assertTrue(instance.tryTransitionTo(RunStatus.FAILED));
    }

    @Test
    void submittedMayFinishWithoutBeingSeenRunning() {
        for (RunStatus terminal : List.of(RunStatus.COMPLETED, RunStatus.FAILED, RunStatus.CANCELLED)) {
            assertTrue(RunStatus.SUBMITTED.canTransitionTo(terminal), terminal.name());
        }
        assertFalse(RunStatus.SUBMITTED.canTransitionTo(RunStatus.PENDING));
        assertFalse(RunStatus.RUNNING.canTransitionTo(RunStatus.SUBMITTED));
    }

    @Test
    void resetReturnsToPendingWithoutJob() {
        RunInstance instance = new RunInstance("b", Map.of(), CONFIG, 0);
        instance.markSubmitted("9");
        instance.transitionTo(RunStatus.COMPLETED);

        instance.resetForResubmission();

        assertEquals(RunStatus.PENDING, instance.status());
        assertEquals(Optional.empty(), instance.jobId());
    }

    @Test
    void restoreChecksTheStoredIdentifier() {
        RunInstance restored = RunInstance.restore(
                "b__n=1__r2", "b", Map.of("n", "1"), CONFIG, 2, RunStatus.COMPLETED, "11");

        assertEquals(RunStatus.COMPLETED, restored.status());
        assertEquals(Optional.of("11"), restored.jobId());
        assertThrows(
                IllegalArgumentException.class,
                () -> RunInstance.restore("b__n=2__r2", "b", Map.of("n", "1"), CONFIG, 2, RunStatus.COMPLETED, null));
    }
}
