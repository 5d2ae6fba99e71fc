package io.github.drompincen.bugtrackr.gateway.controller;

import io.github.drompincen.bugtrackr.persistence.repository.BugFilter;
import io.github.drompincen.bugtrackr.protocol.api.ActivityLog;
import io.github.drompincen.bugtrackr.protocol.api.AssignBugRequest;
import io.github.drompincen.bugtrackr.protocol.api.Bug;
import io.github.drompincen.bugtrackr.protocol.api.BugStatus;
import io.github.drompincen.bugtrackr.protocol.api.BugUpdateResponse;
import io.github.drompincen.bugtrackr.protocol.api.BugWithComments;
import io.github.drompincen.bugtrackr.protocol.api.CreateBugRequest;
import io.github.drompincen.bugtrackr.protocol.api.StatusUpdateRequest;
import io.github.drompincen.bugtrackr.protocol.api.ValidateBugRequest;
import io.github.drompincen.bugtrackr.runtime.bug.BugService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/bugs")
public class BugController {

    private final BugService bugService;

    public BugController(BugService bugService) {
        this.bugService = bugService;
    }

    @PostMapping
    public ResponseEntity<Bug> create(@RequestBody CreateBugRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(bugService.createBug(req));
    }

    /** {@code status} may repeat; values are wire values such as "In Progress". */
    @GetMapping
    public List<Bug> list(@RequestParam(required = false) String projectId,
                          @RequestParam(required = false) List<String> status,
                          @RequestParam(required = false) String assignedTo) {
        Set<BugStatus> statuses = status == null ? Set.of()
                : status.stream().map(BugStatus::fromWire).collect(Collectors.toSet());
        return bugService.listBugs(new BugFilter(projectId, statuses, assignedTo));
    }

    @GetMapping("/{bugId}")
    public BugWithComments get(@PathVariable String bugId) {
        return bugService.getBugWithComments(bugId);
    }

    @GetMapping("/{bugId}/activity")
    public List<ActivityLog> activity(@PathVariable String bugId) {
        return bugService.activityFor(bugId);
    }

    @PatchMapping("/{bugId}/status")
    public BugUpdateResponse updateStatus(@PathVariable String bugId, @RequestBody StatusUpdateRequest req) {
        return bugService.changeStatus(bugId, req);
    }

    @PatchMapping("/{bugId}/validate")
    public BugUpdateResponse validate(@PathVariable String bugId, @RequestBody ValidateBugRequest req) {
        return bugService.validateBug(bugId, req);
    }

    @PatchMapping("/{bugId}/assign")
    public BugUpdateResponse assign(@PathVariable String bugId, @RequestBody AssignBugRequest req) {
        return bugService.assignBug(bugId, req);
    }
}
