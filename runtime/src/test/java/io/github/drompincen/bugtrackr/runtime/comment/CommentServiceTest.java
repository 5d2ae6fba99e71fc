package io.github.drompincen.bugtrackr.runtime.comment;

import io.github.drompincen.bugtrackr.persistence.repository.BugRepository;
import io.github.drompincen.bugtrackr.persistence.repository.CommentRepository;
import io.github.drompincen.bugtrackr.persistence.repository.UserRepository;
import io.github.drompincen.bugtrackr.protocol.api.Bug;
import io.github.drompincen.bugtrackr.protocol.api.BugPriority;
import io.github.drompincen.bugtrackr.protocol.api.BugSeverity;
import io.github.drompincen.bugtrackr.protocol.api.BugStatus;
import io.github.drompincen.bugtrackr.protocol.api.Comment;
import io.github.drompincen.bugtrackr.protocol.api.CreateCommentRequest;
import io.github.drompincen.bugtrackr.protocol.api.User;
import io.github.drompincen.bugtrackr.protocol.error.ConsistencyFatalException;
import io.github.drompincen.bugtrackr.protocol.error.NotFoundException;
import io.github.drompincen.bugtrackr.protocol.error.RemoteStoreException;
import io.github.drompincen.bugtrackr.protocol.error.ValidationException;
import io.github.drompincen.bugtrackr.runtime.saga.ConsistencyCoordinator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CommentServiceTest {

    private static final Instant CREATED = Instant.parse("2024-05-01T08:00:00Z");
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock private CommentRepository comments;
    @Mock private BugRepository bugs;
    @Mock private UserRepository users;

    private CommentService service;

    @BeforeEach
    void setUp() {
        service = new CommentService(comments, bugs, users,
                new ConsistencyCoordinator(Clock.fixed(NOW, ZoneOffset.UTC)));
        when(comments.collection()).thenReturn("");
        when(bugs.get("b1")).thenReturn(new Bug("b1", "Crash", "Trace", "p1", "u1", null, BugStatus.OPEN,
                BugPriority.HIGH, BugSeverity.MAJOR, List.of(), false, CREATED, CREATED));
        when(users.findById("u2")).thenReturn(Optional.of(new User("u2", "Dana", "dana@example.com", "tester", CREATED)));
        when(comments.create(any())).thenAnswer(inv -> {
            Comment draft = inv.getArgument(0);
            return new Comment("c1", draft.bugId(), draft.authorId(), draft.message(), draft.createdAt());
        });
    }

    @Test
    void addCommentTouchesBugWithCommentTimestamp() {
        Comment created = service.addComment(new CreateCommentRequest("b1", "u2", "Reproduced on 2.1"));

        assertThat(created.id()).isEqualTo("c1");
        assertThat(created.createdAt()).isEqualTo(NOW);
        verify(bugs).touch("b1", NOW);
        verify(comments, never()).delete(any());
    }

    @Test
    void touchKeepsLaterUpdatedAtOfBug() {
        Instant later = NOW.plusSeconds(90);
        when(bugs.get("b1")).thenReturn(new Bug("b1", "Crash", "Trace", "p1", "u1", null, BugStatus.OPEN,
                BugPriority.HIGH, BugSeverity.MAJOR, List.of(), false, CREATED, later));

        Comment created = service.addComment(new CreateCommentRequest("b1", "u2", "Seen again"));

        assertThat(created.createdAt()).isEqualTo(NOW);
        verify(bugs).touch("b1", later);
        verify(bugs, never()).touch("b1", NOW);
    }

    @Test
    void failedTouchDeletesComment() {
        RemoteStoreException storeDown = new RemoteStoreException("update", 503, "unavailable", null);
        when(bugs.touch(any(), any())).thenThrow(storeDown);
        when(comments.delete("c1")).thenReturn(true);

        assertThatThrownBy(() -> service.addComment(new CreateCommentRequest("b1", "u2", "Hi")))
                .isSameAs(storeDown);
        verify(comments).delete("c1");
    }

    @Test
    void failedRollbackIsFatalAndLocatesOrphan() {
        when(bugs.touch(any(), any())).thenThrow(new RemoteStoreException("update", 503, "unavailable", null));
        when(comments.delete("c1")).thenThrow(new RemoteStoreException("delete", "timed out", null));

        assertThatThrownBy(() -> service.addComment(new CreateCommentRequest("b1", "u2", "Hi")))
                .isInstanceOfSatisfying(ConsistencyFatalException.class, e -> {
                    assertThat(e.getItemId()).isEqualTo("c1");
                    assertThat(e.getCollection()).isEqualTo("");
                    assertThat(e.getMessage()).contains("c1").contains("manual cleanup");
                });
    }

    @Test
    void missingBugOrAuthorWritesNothing() {
        when(bugs.get("b9")).thenThrow(new NotFoundException("bug", "b9"));
        when(users.findById("u9")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.addComment(new CreateCommentRequest("b9", "u2", "Hi")))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> service.addComment(new CreateCommentRequest("b1", "u9", "Hi")))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("User with ID u9 not found");
        verify(comments, never()).create(any());
    }

    @Test
    void blankMessageIsRejected() {
        assertThatThrownBy(() -> service.addComment(new CreateCommentRequest("b1", "u2", "  ")))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(bugs);
    }

    @Test
    void listsCommentsOfExistingBug() {
        Comment first = new Comment("c1", "b1", "u2", "First", CREATED);
        when(comments.findByBugId("b1")).thenReturn(List.of(first));

        assertThat(service.commentsFor("b1")).containsExactly(first);
    }

    @Test
    void createdCommentCarriesAuthorAndBug() {
        service.addComment(new CreateCommentRequest("b1", "u2", "Looks fixed"));

        ArgumentCaptor<Comment> written = ArgumentCaptor.forClass(Comment.class);
        verify(comments).create(written.capture());
        assertThat(written.getValue().id()).isNull();
        assertThat(written.getValue().authorId()).isEqualTo("u2");
        assertThat(written.getValue().message()).isEqualTo("Looks fixed");
    }
}
