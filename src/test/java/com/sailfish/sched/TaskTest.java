package com.sailfish.sched;

import com.sailfish.sched.model.TaskStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TaskTest {

    @Mock
    private TaskObserver first;

    @Mock
    private TaskObserver second;

    @Test
    void newTaskIsPending() {
        Instant before = Instant.now();
        Task task = ScriptedTask.succeeding(1);

        assertEquals(1, task.getId());
        assertEquals("task-1", task.getName());
        assertEquals(TaskStatus.PENDING, task.getStatus());
        assertFalse(task.isTerminal());
        assertNull(task.getFailureReason());
        assertFalse(task.getCreatedAt().isBefore(before));
        assertTrue(task.getObservers().isEmpty());
    }

    @Test
    void successfulRunGoesThroughRunningToCompleted() {
        RecordingObserver recorder = new RecordingObserver();
        Task task = ScriptedTask.succeeding(1);
        task.attach(recorder);

        TaskStatus result = task.run();

        assertEquals(TaskStatus.COMPLETED, result);
        assertEquals(TaskStatus.COMPLETED, task.getStatus());
        assertTrue(task.isTerminal());
        assertEquals(List.of(TaskStatus.PENDING, TaskStatus.RUNNING, TaskStatus.COMPLETED), recorder.sequenceOf(1));
    }

    @Test
    void faultResultEndsInFailed() {
        RecordingObserver recorder = new RecordingObserver();
        Task task = new ScriptedTask(2, "smtp", () -> WorkResult.fault("mail server unreachable"));
        task.attach(recorder);

        assertEquals(TaskStatus.FAILED, task.run());
        assertEquals("mail server unreachable", task.getFailureReason());
        assertEquals(List.of(TaskStatus.PENDING, TaskStatus.RUNNING, TaskStatus.FAILED), recorder.sequenceOf(2));
    }

    @Test
    void exceptionInWorkStepIsContainedAndEndsInFailed() {
        RecordingObserver recorder = new RecordingObserver();
        Task task = new ScriptedTask(3, "backup", () -> {
            throw new IllegalStateException("disk full");
        });
        task.attach(recorder);

        TaskStatus result = assertDoesNotThrow(task::run);

        assertEquals(TaskStatus.FAILED, result);
        assertEquals("disk full", task.getFailureReason());
        assertEquals(List.of(TaskStatus.PENDING, TaskStatus.RUNNING, TaskStatus.FAILED), recorder.sequenceOf(3));
    }

    @Test
    void exceptionWithoutMessageUsesClassNameAsReason() {
        Task task = new ScriptedTask(4, "npe", () -> {
            throw new NullPointerException();
        });

        assertEquals(TaskStatus.FAILED, task.run());
        assertEquals(NullPointerException.class.getName(), task.getFailureReason());
    }

    @Test
    void nullResultIsTreatedAsFault() {
        Task task = new ScriptedTask(5, "broken", () -> null);

        assertEquals(TaskStatus.FAILED, task.run());
        assertNotNull(task.getFailureReason());
    }

    @Test
    void interruptionFailsTaskAndKeepsInterruptFlag() {
        Task task = new ScriptedTask(6, "slow", () -> {
            throw new InterruptedException("stop");
        });

        try {
            assertEquals(TaskStatus.FAILED, task.run());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted(); // clear for the next test
        }
    }

    @Test
    void observersAreNotifiedInAttachmentOrderForEachTransition() {
        Task task = ScriptedTask.succeeding(7);
        task.attach(first);
        task.attach(second);

        task.run();

        InOrder inOrder = inOrder(first, second);
        inOrder.verify(first).onTransition(task, TaskStatus.PENDING, TaskStatus.RUNNING);
        inOrder.verify(second).onTransition(task, TaskStatus.PENDING, TaskStatus.RUNNING);
        inOrder.verify(first).onTransition(task, TaskStatus.RUNNING, TaskStatus.COMPLETED);
        inOrder.verify(second).onTransition(task, TaskStatus.RUNNING, TaskStatus.COMPLETED);
        verifyNoMoreInteractions(first, second);
    }

    @Test
    void observerSeesNewStatusAlreadyApplied() {
        Task task = ScriptedTask.succeeding(8);
        task.attach((t, oldStatus, newStatus) -> assertEquals(newStatus, t.getStatus()));

        assertEquals(TaskStatus.COMPLETED, task.run());
    }

    @Test
    void sameObserverAttachedTwiceIsNotifiedTwicePerTransition() {
        Task task = ScriptedTask.succeeding(9);
        task.attach(first);
        task.attach(first);

        task.run();

        assertEquals(2, task.getObservers().size());
        verify(first, times(2)).onTransition(task, TaskStatus.PENDING, TaskStatus.RUNNING);
        verify(first, times(2)).onTransition(task, TaskStatus.RUNNING, TaskStatus.COMPLETED);
    }

    @Test
    void failingObserverDoesNotStopOtherObserversOrTheTask() {
        Task task = ScriptedTask.succeeding(10);
        doThrow(new RuntimeException("boom")).when(first).onTransition(any(), any(), any());
        task.attach(first);
        task.attach(second);

        assertEquals(TaskStatus.COMPLETED, task.run());
        verify(second).onTransition(task, TaskStatus.PENDING, TaskStatus.RUNNING);
        verify(second).onTransition(task, TaskStatus.RUNNING, TaskStatus.COMPLETED);
    }

    @Test
    void secondRunIsIgnored() {
        Task task = ScriptedTask.succeeding(11);
        task.run();
        task.attach(first);

        assertEquals(TaskStatus.COMPLETED, task.run());
        verifyNoInteractions(first);
    }

    @Test
    void attachRejectsNull() {
        Task task = ScriptedTask.succeeding(12);
        assertThrows(NullPointerException.class, () -> task.attach(null));
    }

    @Test
    void observerListCannotBeModifiedFromOutside() {
        Task task = ScriptedTask.succeeding(13);
        task.attach(first);

        assertThrows(UnsupportedOperationException.class, () -> task.getObservers().clear());
    }

    @Test
    void illegalTransitionIsRejected() {
        ScriptedTask task = ScriptedTask.succeeding(14);

        assertThrows(IllegalStateException.class, () -> task.setStatus(TaskStatus.COMPLETED));
        assertEquals(TaskStatus.PENDING, task.getStatus());
    }

    @Test
    void checkedExceptionFromWorkStepEndsInFailed() {
        RecordingObserver recorder = new RecordingObserver();
        Task task = new ScriptedTask(15, "backup", () -> {
            throw sneaky(new IOException("disk gone"));
        });
        task.attach(recorder);

        TaskStatus result = assertDoesNotThrow(task::run);

        assertEquals(TaskStatus.FAILED, result);
        assertEquals("disk gone", task.getFailureReason());
        assertEquals(List.of(TaskStatus.PENDING, TaskStatus.RUNNING, TaskStatus.FAILED), recorder.sequenceOf(15));
    }

    @Test
    void errorFromWorkStepEndsInFailedAndIsRethrown() {
        RecordingObserver recorder = new RecordingObserver();
        Task task = new ScriptedTask(16, "report", () -> {
            throw new AssertionError("bad state");
        });
        task.attach(recorder);

        AssertionError e = assertThrows(AssertionError.class, task::run);

        assertEquals("bad state", e.getMessage());
        assertEquals(TaskStatus.FAILED, task.getStatus());
        assertEquals("bad state", task.getFailureReason());
        assertEquals(List.of(TaskStatus.PENDING, TaskStatus.RUNNING, TaskStatus.FAILED), recorder.sequenceOf(16));
    }

    @Test
    void workStepThatSetsItsOwnTerminalStatusDoesNotBreakRun() {
        RecordingObserver recorder = new RecordingObserver();
        Task task = new Task(17, "self-completing") {
            @Override
            protected WorkResult execute() {
                setStatus(TaskStatus.COMPLETED);
                return WorkResult.ok();
            }
        };
        task.attach(recorder);

        TaskStatus result = assertDoesNotThrow(task::run);

        assertEquals(TaskStatus.COMPLETED, result);
        assertEquals(List.of(TaskStatus.PENDING, TaskStatus.RUNNING, TaskStatus.COMPLETED), recorder.sequenceOf(17));
    }

    @SuppressWarnings("unchecked")
    private static <E extends Throwable> RuntimeException sneaky(Throwable t) throws E {
        throw (E) t;
    }
}
