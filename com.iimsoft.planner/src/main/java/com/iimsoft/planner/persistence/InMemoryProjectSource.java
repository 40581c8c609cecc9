package com.iimsoft.planner.persistence;

import com.iimsoft.planner.domain.Project;
import com.iimsoft.planner.service.port.ProjectSource;

import java.util.LinkedHashMap;
import java.util.Map;

public class InMemoryProjectSource implements ProjectSource {

    private final Map<Long, Project> projects = new LinkedHashMap<>();

    public InMemoryProjectSource add(Project project) {
        projects.put(project.getId(), project);
        return this;
    }

    @Override
    public Project getProject(Long projectId) {
        return projects.get(projectId);
    }
}
