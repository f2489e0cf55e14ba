package com.flamingo.ai.ingestion.domain.enums;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

@DisplayName("TaskStatus Tests")
class TaskStatusTest {

  @Test
  @DisplayName("Should allow the forward path")
  void shouldAllowForwardPath() {
    assertThat(TaskStatus.PENDING.canTransitionTo(TaskStatus.IN_PROGRESS)).isTrue();
    assertThat(TaskStatus.IN_PROGRESS.canTransitionTo(TaskStatus.COMPLETED)).isTrue();
    assertThat(TaskStatus.IN_PROGRESS.canTransitionTo(TaskStatus.FAILED)).isTrue();
    assertThat(TaskStatus.PENDING.canTransitionTo(TaskStatus.FAILED)).isTrue();
  }

  @Test
  @DisplayName("Should reject moving backwards or skipping the running state")
  void shouldRejectBackwardTransitions() {
    assertThat(TaskStatus.IN_PROGRESS.canTransitionTo(TaskStatus.PENDING)).isFalse();
    assertThat(TaskStatus.PENDING.canTransitionTo(TaskStatus.COMPLETED)).isFalse();
    assertThat(TaskStatus.PENDING.canTransitionTo(null)).isFalse();
  }

  @ParameterizedTest
  @EnumSource(value = TaskStatus.class, names = {"COMPLETED", "FAILED"})
  @DisplayName("Should never leave a terminal status")
  void shouldNeverLeaveTerminalStatus(TaskStatus terminal) {
    assertThat(terminal.isTerminal()).isTrue();
    for (TaskStatus next : TaskStatus.values()) {
      assertThat(terminal.canTransitionTo(next)).isFalse();
    }
  }
}
