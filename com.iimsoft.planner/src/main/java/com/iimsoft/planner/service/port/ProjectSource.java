package com.iimsoft.planner.service.port;

import com.iimsoft.planner.domain.Project;

public interface ProjectSource {

    /** 不存在时返回 null */
    Project getProject(Long projectId);
}
