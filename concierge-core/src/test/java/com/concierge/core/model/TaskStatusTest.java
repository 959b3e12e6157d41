package com.concierge.core.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

class TaskStatusTest {

    @ParameterizedTest
    @EnumSource(value = TaskStatus.class, names = {"SUCCESS", "FAILURE", "CANCELLED"})
    void terminalStates_shouldHaveNoTargets(TaskStatus status) {
        assertTrue(status.isTerminal());
        assertTrue(status.allowedTargets().isEmpty());
        for (TaskStatus target : TaskStatus.values()) {
            assertFalse(status.canTransitionTo(target));
        }
    }

    @Test
    void happyPath_shouldBeAllowed() {
        assertTrue(TaskStatus.PENDING.canTransitionTo(TaskStatus.QUEUED));
        assertTrue(TaskStatus.QUEUED.canTransitionTo(TaskStatus.RUNNING));
        assertTrue(TaskStatus.RUNNING.canTransitionTo(TaskStatus.SUCCESS));
    }

    @Test
    void retryLoop_shouldBeAllowed() {
        assertTrue(TaskStatus.RUNNING.canTransitionTo(TaskStatus.RETRYING));
        assertTrue(TaskStatus.RETRYING.canTransitionTo(TaskStatus.RUNNING));
        assertTrue(TaskStatus.RETRYING.canTransitionTo(TaskStatus.QUEUED));
    }

    @Test
    void skippingQueue_shouldNotBeAllowed() {
        assertFalse(TaskStatus.PENDING.canTransitionTo(TaskStatus.RUNNING));
        assertFalse(TaskStatus.QUEUED.canTransitionTo(TaskStatus.SUCCESS));
    }

    @Test
    void sourcesOf_running_shouldIncludeRedelivery() {
        assertTrue(TaskStatus.sourcesOf(TaskStatus.RUNNING).containsAll(
            java.util.EnumSet.of(TaskStatus.QUEUED, TaskStatus.RETRYING, TaskStatus.RUNNING)));
        assertFalse(TaskStatus.sourcesOf(TaskStatus.RUNNING).contains(TaskStatus.PENDING));
    }

    @Test
    void wireValues_shouldRoundTrip() {
        assertEquals(TaskStatus.RETRYING, TaskStatus.fromWireValue("retrying"));
        assertEquals("success", TaskStatus.SUCCESS.wireValue());
        assertThrows(IllegalArgumentException.class, () -> TaskStatus.fromWireValue("done"));
    }
}
