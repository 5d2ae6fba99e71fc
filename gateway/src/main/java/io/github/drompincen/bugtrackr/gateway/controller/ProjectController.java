package io.github.drompincen.bugtrackr.gateway.controller;

import io.github.drompincen.bugtrackr.protocol.api.CreateProjectRequest;
import io.github.drompincen.bugtrackr.protocol.api.Project;
import io.github.drompincen.bugtrackr.runtime.project.ProjectService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/projects")
public class ProjectController {

    private final ProjectService projectService;

    public ProjectController(ProjectService projectService) {
        this.projectService = projectService;
    }

    @PostMapping
    public ResponseEntity<Project> create(@RequestBody CreateProjectRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(projectService.createProject(req));
    }

    @GetMapping
    public List<Project> list() {
        return projectService.listProjects();
    }

    @GetMapping("/{projectId}")
    public Project get(@PathVariable String projectId) {
        return projectService.getProject(projectId);
    }

    @PutMapping("/{projectId}")
    public Project update(@PathVariable String projectId, @RequestBody Map<String, Object> updates) {
        return projectService.updateProject(projectId, updates);
    }
}
