package com.iimsoft.planner.service;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * 某个人在一个项目里的全部任务。
 */
@Data
public class PersonWorkload {
    Long personId;
    List<Entry> tasks = new ArrayList<>();
    int totalWorkingDuration;

    public PersonWorkload(Long personId) {
        this.personId = personId;
    }

    void add(Entry entry) {
        tasks.add(entry);
        totalWorkingDuration += entry.workingDuration;
    }

    @Data
    @AllArgsConstructor
    public static class Entry {
        Long taskId;
        // 子任务为 "组任务名 - 子任务名"
        String displayName;
        LocalDate startDate;
        LocalDate endDate;
        int workingDuration;
        boolean parallel;
    }
}
