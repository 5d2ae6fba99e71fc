package io.github.drompincen.bugtrackr.runtime.bug;

import io.github.drompincen.bugtrackr.persistence.repository.ActivityLogRepository;
import io.github.drompincen.bugtrackr.persistence.repository.BugFilter;
import io.github.drompincen.bugtrackr.persistence.repository.BugRepository;
import io.github.drompincen.bugtrackr.persistence.repository.CommentRepository;
import io.github.drompincen.bugtrackr.persistence.repository.ProjectRepository;
import io.github.drompincen.bugtrackr.persistence.repository.UserRepository;
import io.github.drompincen.bugtrackr.protocol.api.ActivityLog;
import io.github.drompincen.bugtrackr.protocol.api.AssignBugRequest;
import io.github.drompincen.bugtrackr.protocol.api.Bug;
import io.github.drompincen.bugtrackr.protocol.api.BugStatus;
import io.github.drompincen.bugtrackr.protocol.api.BugUpdateResponse;
import io.github.drompincen.bugtrackr.protocol.api.BugWithComments;
import io.github.drompincen.bugtrackr.protocol.api.CreateBugRequest;
import io.github.drompincen.bugtrackr.protocol.api.StatusUpdateRequest;
import io.github.drompincen.bugtrackr.protocol.api.User;
import io.github.drompincen.bugtrackr.protocol.api.UserRole;
import io.github.drompincen.bugtrackr.protocol.api.ValidateBugRequest;
import io.github.drompincen.bugtrackr.protocol.error.NotFoundException;
import io.github.drompincen.bugtrackr.runtime.Requests;
import io.github.drompincen.bugtrackr.runtime.policy.TransitionPolicy;
import io.github.drompincen.bugtrackr.runtime.saga.ConsistencyCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

@Service
public class BugService {

    private static final Logger log = LoggerFactory.getLogger(BugService.class);

    private final BugRepository bugs;
    private final CommentRepository comments;
    private final ActivityLogRepository activity;
    private final ProjectRepository projects;
    private final UserRepository users;
    private final TransitionPolicy policy;
    private final ConsistencyCoordinator coordinator;
    private final Clock clock;

    public BugService(BugRepository bugs, CommentRepository comments, ActivityLogRepository activity,
                      ProjectRepository projects, UserRepository users, TransitionPolicy policy,
                      ConsistencyCoordinator coordinator, Clock clock) {
        this.bugs = bugs;
        this.comments = comments;
        this.activity = activity;
        this.projects = projects;
        this.users = users;
        this.policy = policy;
        this.coordinator = coordinator;
        this.clock = clock;
    }

    // ---- Reads ----

    public List<Bug> listBugs(BugFilter filter) {
        return bugs.findAll(filter != null ? filter : BugFilter.all());
    }

    public Bug getBug(String bugId) {
        return bugs.get(bugId);
    }

    public BugWithComments getBugWithComments(String bugId) {
        Bug bug = bugs.get(bugId);
        return new BugWithComments(bug, comments.findByBugId(bug.id()));
    }

    /** Audit trail of the bug, newest first. */
    public List<ActivityLog> activityFor(String bugId) {
        Bug bug = bugs.get(bugId);
        return activity.findByBugId(bug.id());
    }

    // ---- Writes ----

    public Bug createBug(CreateBugRequest request) {
        Requests.require("request", request);
        Bug bug = Bug.open(request.title(), request.description(), request.projectId(), request.reportedBy(),
                request.priority(), request.severity(), clock.instant());
        if (projects.findById(bug.projectId()).isEmpty()) {
            throw new NotFoundException("project", bug.projectId());
        }
        Bug created = bugs.create(bug);
        log.info("Bug created: {} for project {}", created.id(), created.projectId());
        return created;
    }

    public BugUpdateResponse changeStatus(String bugId, StatusUpdateRequest request) {
        Requests.require("request", request);
        BugStatus requested = Requests.require("status", request.status());
        String userId = Requests.requireText("userId", request.userId());
        UserRole role = UserRole.fromWire(request.userRole());

        Bug current = bugs.get(bugId);
        BugStatus next = policy.evaluate(current.status(), requested, role, current.validated()).orThrow();

        Bug updated = coordinator.execute(new AuditedBugUpdate(bugs, activity, clock, "change status", current,
                ActivityLog.STATUS_CHANGED, userId,
                (bug, at) -> bugs.updateStatus(bug.id(), next, at),
                (bug, at) -> bugs.updateStatus(bug.id(), bug.status(), at)));
        log.info("Bug {} status updated: {} -> {} by {}", bugId, current.status().wireValue(),
                next.wireValue(), userId);
        return BugUpdateResponse.ok("Bug status updated to " + next.wireValue(), updated);
    }

    public BugUpdateResponse validateBug(String bugId, ValidateBugRequest request) {
        Requests.require("request", request);
        String userId = Requests.requireText("userId", request.userId());
        policy.evaluateValidation(UserRole.fromWire(request.userRole())).orThrow();

        Bug current = bugs.get(bugId);
        Bug updated = coordinator.execute(new AuditedBugUpdate(bugs, activity, clock, "validate bug", current,
                ActivityLog.BUG_VALIDATED, userId,
                (bug, at) -> bugs.updateValidation(bug.id(), true, at),
                (bug, at) -> bugs.updateValidation(bug.id(), bug.validated(), at)));
        log.info("Bug {} validated by {}", bugId, userId);
        return BugUpdateResponse.ok("Bug validated successfully", updated);
    }

    public BugUpdateResponse assignBug(String bugId, AssignBugRequest request) {
        Requests.require("request", request);
        String assignedTo = Requests.requireText("assignedTo", request.assignedTo());
        String assignedBy = Requests.requireText("assignedBy", request.assignedBy());

        Bug current = bugs.get(bugId);
        User assignee = users.findById(assignedTo)
                .orElseThrow(() -> new NotFoundException("user", assignedTo));

        Bug updated = coordinator.execute(new AuditedBugUpdate(bugs, activity, clock, "assign bug", current,
                ActivityLog.BUG_ASSIGNED, assignedBy,
                (bug, at) -> bugs.updateAssignment(bug.id(), assignedTo, at),
                (bug, at) -> bugs.updateAssignment(bug.id(), bug.assignedTo(), at)));
        log.info("Bug {} assigned to {} by {}", bugId, assignedTo, assignedBy);
        return BugUpdateResponse.ok("Bug assigned to " + assignee.name(), updated);
    }
}
