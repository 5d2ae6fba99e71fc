package io.github.drompincen.bugtrackr.runtime.project;

import io.github.drompincen.bugtrackr.persistence.repository.ProjectRepository;
import io.github.drompincen.bugtrackr.persistence.repository.UserRepository;
import io.github.drompincen.bugtrackr.protocol.api.CreateProjectRequest;
import io.github.drompincen.bugtrackr.protocol.api.Project;
import io.github.drompincen.bugtrackr.protocol.error.NotFoundException;
import io.github.drompincen.bugtrackr.runtime.Requests;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

@Service
public class ProjectService {

    private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

    private final ProjectRepository projects;
    private final UserRepository users;
    private final Clock clock;

    public ProjectService(ProjectRepository projects, UserRepository users, Clock clock) {
        this.projects = projects;
        this.users = users;
        this.clock = clock;
    }

    public List<Project> listProjects() {
        return projects.findAll();
    }

    public Project getProject(String projectId) {
        return projects.get(projectId);
    }

    /** The creation time is kept to whole seconds, the precision of the stored layout. */
    public Project createProject(CreateProjectRequest request) {
        Requests.require("request", request);
        Project project = new Project(null, request.name(), request.description(), request.createdBy(),
                clock.instant().truncatedTo(ChronoUnit.SECONDS));
        if (users.findById(project.createdBy()).isEmpty()) {
            throw new NotFoundException("user", project.createdBy());
        }
        Project created = projects.create(project);
        log.info("Project created: {} ({})", created.id(), created.name());
        return created;
    }

    /** Accepts {@code name}, {@code description} and {@code createdBy}. */
    public Project updateProject(String projectId, Map<String, Object> updates) {
        Project updated = projects.updateFields(projectId, updates);
        log.info("Project {} updated: {}", projectId, updates.keySet());
        return updated;
    }
}
