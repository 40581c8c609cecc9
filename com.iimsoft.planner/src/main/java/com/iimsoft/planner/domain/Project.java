package com.iimsoft.planner.domain;

import java.time.LocalDate;

public class Project {

    private Long id;
    private String name;

    // 日历起点，不含时分秒
    private LocalDate startDate;

    public Project() {
    }

    public Project(Long id, String name, LocalDate startDate) {
        this.id = id;
        this.name = name;
        this.startDate = startDate;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public LocalDate getStartDate() { return startDate; }
    public void setStartDate(LocalDate startDate) { this.startDate = startDate; }

    public String getLabel() {
        return name == null || name.isBlank() ? "Project " + id : name;
    }
}
