package io.github.drompincen.bugtrackr.protocol.error;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConsistencyFatalExceptionTest {

    @Test
    void messageNamesTheOrphan() {
        ConsistencyFatalException e = new ConsistencyFatalException(
                "add comment", "", "c-42", new IllegalStateException("bug update failed"));

        assertThat(e.getCollection()).isEmpty();
        assertThat(e.getItemId()).isEqualTo("c-42");
        assertThat(e.getOperation()).isEqualTo("add comment");
        assertThat(e.getMessage()).contains("c-42").contains("base").contains("manual cleanup");
        assertThat(e.getCause()).hasMessage("bug update failed");
    }

    @Test
    void notFoundMessageCapitalisesKind() {
        NotFoundException e = new NotFoundException("project", "p9");

        assertThat(e.getMessage()).isEqualTo("Project with ID p9 not found");
        assertThat(e.getKind()).isEqualTo("project");
    }
}
