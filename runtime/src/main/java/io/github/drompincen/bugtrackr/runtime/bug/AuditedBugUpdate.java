package io.github.drompincen.bugtrackr.runtime.bug;

import io.github.drompincen.bugtrackr.persistence.repository.ActivityLogRepository;
import io.github.drompincen.bugtrackr.persistence.repository.BugRepository;
import io.github.drompincen.bugtrackr.protocol.api.ActivityLog;
import io.github.drompincen.bugtrackr.protocol.api.Bug;
import io.github.drompincen.bugtrackr.runtime.saga.CompensableWrite;
import io.github.drompincen.bugtrackr.runtime.saga.ItemRef;

import java.time.Clock;
import java.time.Instant;

/**
 * A guarded bug change followed by its audit entry. Undoing writes the previous values
 * back with a fresh last-modified time.
 */
final class AuditedBugUpdate implements CompensableWrite<Bug> {

    /** A single-call write to {@code bug} stamped with {@code updatedAt}. */
    @FunctionalInterface
    interface BugWrite {
        Bug write(Bug bug, Instant updatedAt);
    }

    private final BugRepository bugs;
    private final ActivityLogRepository activity;
    private final Clock clock;
    private final String operation;
    private final Bug before;
    private final String action;
    private final String performedBy;
    private final BugWrite change;
    private final BugWrite restore;

    AuditedBugUpdate(BugRepository bugs, ActivityLogRepository activity, Clock clock, String operation,
                     Bug before, String action, String performedBy, BugWrite change, BugWrite restore) {
        this.bugs = bugs;
        this.activity = activity;
        this.clock = clock;
        this.operation = operation;
        this.before = before;
        this.action = action;
        this.performedBy = performedBy;
        this.change = change;
        this.restore = restore;
    }

    @Override
    public String operation() {
        return operation;
    }

    @Override
    public Bug apply(Instant at) {
        return change.write(before, before.nextModification(at));
    }

    @Override
    public void followUp(Bug written, Instant at) {
        activity.append(new ActivityLog(null, written.id(), action, performedBy, at));
    }

    @Override
    public void compensate(Bug written) {
        restore.write(before, written.nextModification(clock.instant()));
    }

    @Override
    public ItemRef locate(Bug written) {
        return new ItemRef(bugs.collection(), written.id());
    }
}
