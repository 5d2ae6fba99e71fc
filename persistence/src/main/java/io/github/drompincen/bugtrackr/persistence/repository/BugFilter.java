package io.github.drompincen.bugtrackr.persistence.repository;

import io.github.drompincen.bugtrackr.protocol.api.Bug;
import io.github.drompincen.bugtrackr.protocol.api.BugStatus;

import java.util.Set;
import java.util.function.Predicate;

/** Bug list criteria; null or empty criteria are ignored. */
public record BugFilter(String projectId, Set<BugStatus> statuses, String assignedTo) {

    public BugFilter {
        projectId = projectId == null || projectId.isBlank() ? null : projectId;
        statuses = statuses != null ? Set.copyOf(statuses) : Set.of();
        assignedTo = assignedTo == null || assignedTo.isBlank() ? null : assignedTo;
    }

    public static BugFilter all() {
        return new BugFilter(null, null, null);
    }

    public Predicate<Bug> toPredicate() {
        return Filters.<Bug, String>equalTo(Bug::projectId, projectId)
                .and(Filters.memberOf(Bug::status, statuses))
                .and(Filters.equalTo(Bug::assignedTo, assignedTo));
    }
}
