package com.processflow.core.model;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ProcessStatusTest {

    @Test
    void isTerminal_shouldIdentifyTerminalStatuses() {
        assertTrue(ProcessStatus.COMPLETED.isTerminal());
        assertTrue(ProcessStatus.CANCELLED.isTerminal());
        assertTrue(ProcessStatus.FAILED.isTerminal());

        assertFalse(ProcessStatus.RUNNING.isTerminal());
        assertFalse(ProcessStatus.SUSPENDED.isTerminal());
    }

    @Test
    void isActive_shouldIdentifyRunningAndSuspended() {
        assertTrue(ProcessStatus.RUNNING.isActive());
        assertTrue(ProcessStatus.SUSPENDED.isActive());

        assertFalse(ProcessStatus.COMPLETED.isActive());
        assertFalse(ProcessStatus.FAILED.isActive());
    }

    @Test
    void operationsFromRunning_shouldCoverEveryNonStartOperationExceptResumeAndRetry() {
        Set<LifecycleOperation> allowed = allowedFrom(ProcessStatus.RUNNING);

        assertEquals(EnumSet.of(
            LifecycleOperation.COMPLETE_TASK,
            LifecycleOperation.SUSPEND,
            LifecycleOperation.CANCEL,
            LifecycleOperation.FAIL,
            LifecycleOperation.UPDATE_VARIABLES), allowed);
    }

    @Test
    void operationsFromSuspended_shouldAllowResumeCancelAndVariableEdits() {
        assertEquals(EnumSet.of(
            LifecycleOperation.RESUME,
            LifecycleOperation.CANCEL,
            LifecycleOperation.UPDATE_VARIABLES), allowedFrom(ProcessStatus.SUSPENDED));
    }

    @Test
    void operationsFromFailed_shouldOnlyAllowRetry() {
        assertEquals(EnumSet.of(LifecycleOperation.RETRY), allowedFrom(ProcessStatus.FAILED));
    }

    @Test
    void operationsFromCompletedOrCancelled_shouldNotAllowAny() {
        assertTrue(allowedFrom(ProcessStatus.COMPLETED).isEmpty());
        assertTrue(allowedFrom(ProcessStatus.CANCELLED).isEmpty());
    }

    @Test
    void lifecycleOperations_shouldOnlyLeadToReachableStatuses() {
        assertTrue(LifecycleOperation.SUSPEND.isAllowedFrom(ProcessStatus.RUNNING));
        assertTrue(LifecycleOperation.CANCEL.isAllowedFrom(ProcessStatus.SUSPENDED));
        assertTrue(LifecycleOperation.RETRY.isAllowedFrom(ProcessStatus.FAILED));
        assertTrue(LifecycleOperation.UPDATE_VARIABLES.isAllowedFrom(ProcessStatus.SUSPENDED));

        assertFalse(LifecycleOperation.RESUME.isAllowedFrom(ProcessStatus.CANCELLED));
        assertFalse(LifecycleOperation.COMPLETE_TASK.isAllowedFrom(ProcessStatus.SUSPENDED));
        assertFalse(LifecycleOperation.FAIL.isAllowedFrom(ProcessStatus.SUSPENDED));
        assertTrue(LifecycleOperation.START.validFrom().isEmpty());
    }

    private static Set<LifecycleOperation> allowedFrom(ProcessStatus status) {
        Set<LifecycleOperation> allowed = EnumSet.noneOf(LifecycleOperation.class);
        for (LifecycleOperation operation : LifecycleOperation.values()) {
            if (operation.isAllowedFrom(status)) {
                allowed.add(operation);
            }
        }
        return allowed;
    }

    @Test
    void wireNames_shouldRoundTrip() {
        for (ProcessStatus status : ProcessStatus.values()) {
            assertEquals(status, ProcessStatus.fromValue(status.wireName()));
        }
        assertEquals(LifecycleOperation.COMPLETE_TASK, LifecycleOperation.fromTag("task_completed"));
        assertEquals("process_started", LifecycleOperation.START.tag());
        assertThrows(IllegalArgumentException.class, () -> LifecycleOperation.fromTag("archive"));
    }
}
