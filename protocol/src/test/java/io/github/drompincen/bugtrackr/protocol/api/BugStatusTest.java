package io.github.drompincen.bugtrackr.protocol.api;

import io.github.drompincen.bugtrackr.protocol.error.ValidationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BugStatusTest {

    @Test
    void statusValuesInWorkflowOrder() {
        assertThat(BugStatus.values()).containsExactly(
                BugStatus.OPEN, BugStatus.IN_PROGRESS, BugStatus.RESOLVED, BugStatus.CLOSED);
    }

    @Test
    void parsesWireValuesAndConstantNames() {
        assertThat(BugStatus.fromWire("In Progress")).isEqualTo(BugStatus.IN_PROGRESS);
        assertThat(BugStatus.fromWire("IN_PROGRESS")).isEqualTo(BugStatus.IN_PROGRESS);
        assertThat(BugPriority.fromWire("Critical")).isEqualTo(BugPriority.CRITICAL);
        assertThat(BugSeverity.fromWire("Blocker")).isEqualTo(BugSeverity.BLOCKER);
    }

    @Test
    void rejectsUnknownValueListingTheValidOnes() {
        assertThatThrownBy(() -> BugStatus.fromWire("Done"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Invalid status")
                .hasMessageContaining("Open, In Progress, Resolved, Closed");
        assertThatThrownBy(() -> BugPriority.fromWire(null))
                .isInstanceOf(ValidationException.class);
    }
}
