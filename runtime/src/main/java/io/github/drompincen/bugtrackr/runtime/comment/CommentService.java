package io.github.drompincen.bugtrackr.runtime.comment;

import io.github.drompincen.bugtrackr.persistence.repository.BugRepository;
import io.github.drompincen.bugtrackr.persistence.repository.CommentRepository;
import io.github.drompincen.bugtrackr.persistence.repository.UserRepository;
import io.github.drompincen.bugtrackr.protocol.api.Bug;
import io.github.drompincen.bugtrackr.protocol.api.Comment;
import io.github.drompincen.bugtrackr.protocol.api.CreateCommentRequest;
import io.github.drompincen.bugtrackr.protocol.error.NotFoundException;
import io.github.drompincen.bugtrackr.runtime.Requests;
import io.github.drompincen.bugtrackr.runtime.saga.CompensableWrite;
import io.github.drompincen.bugtrackr.runtime.saga.ConsistencyCoordinator;
import io.github.drompincen.bugtrackr.runtime.saga.ItemRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

@Service
public class CommentService {

    private static final Logger log = LoggerFactory.getLogger(CommentService.class);

    private final CommentRepository comments;
    private final BugRepository bugs;
    private final UserRepository users;
    private final ConsistencyCoordinator coordinator;

    public CommentService(CommentRepository comments, BugRepository bugs, UserRepository users,
                          ConsistencyCoordinator coordinator) {
        this.comments = comments;
        this.bugs = bugs;
        this.users = users;
        this.coordinator = coordinator;
    }

    /**
     * Adds the comment and bumps the bug's last-modified time to the comment's creation
     * time. If the bug already records a later {@code updatedAt} (clock skew between
     * writers) that later value is kept, so the bug's last-modified time never moves
     * backwards. If the bump fails the comment is deleted again.
     */
    public Comment addComment(CreateCommentRequest request) {
        Requests.require("request", request);
        Comment draft = new Comment(null, request.bugId(), request.authorId(), request.message(), null);
        Comment created = coordinator.execute(new AddComment(draft));
        log.info("Comment {} added to bug {} by {}", created.id(), created.bugId(), created.authorId());
        return created;
    }

    /** Comments on the bug, oldest first. */
    public List<Comment> commentsFor(String bugId) {
        Bug bug = bugs.get(bugId);
        return comments.findByBugId(bug.id());
    }

    private final class AddComment implements CompensableWrite<Comment> {

        private final Comment draft;
        private Bug parent;

        private AddComment(Comment draft) {
            this.draft = draft;
        }

        @Override
        public String operation() {
            return "add comment";
        }

        @Override
        public void checkPreconditions() {
            parent = bugs.get(draft.bugId());
            if (users.findById(draft.authorId()).isEmpty()) {
                throw new NotFoundException("user", draft.authorId());
            }
        }

        @Override
        public Comment apply(Instant at) {
            return comments.create(new Comment(null, draft.bugId(), draft.authorId(), draft.message(), at));
        }

        @Override
        public void followUp(Comment written, Instant at) {
            bugs.touch(parent.id(), parent.nextModification(at));
        }

        @Override
        public void compensate(Comment written) {
            if (!comments.delete(written.id())) {
                log.warn("Comment {} was already gone during rollback", written.id());
            }
        }

        @Override
        public ItemRef locate(Comment written) {
            return new ItemRef(comments.collection(), written.id());
        }
    }
}
