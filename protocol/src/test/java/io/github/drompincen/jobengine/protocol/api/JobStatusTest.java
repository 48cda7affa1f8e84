package io.github.drompincen.jobengine.protocol.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class JobStatusTest {

    @Test
    void allStatusValuesExist() {
        assertThat(JobStatus.values()).containsExactly(
                JobStatus.ACTIVE,
                JobStatus.PAUSED,
                JobStatus.COMPLETED,
                JobStatus.CANCELLED);
    }

    @Test
    void onlyCompletedAndCancelledAreTerminal() {
        assertThat(JobStatus.ACTIVE.isTerminal()).isFalse();
        assertThat(JobStatus.PAUSED.isTerminal()).isFalse();
        assertThat(JobStatus.COMPLETED.isTerminal()).isTrue();
        assertThat(JobStatus.CANCELLED.isTerminal()).isTrue();
    }

    @Test
    void valueOfReturnsCorrectEnum() {
        assertThat(JobStatus.valueOf("PAUSED")).isEqualTo(JobStatus.PAUSED);
    }
}
