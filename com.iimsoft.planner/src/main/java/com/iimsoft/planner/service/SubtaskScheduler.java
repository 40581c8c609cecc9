package com.iimsoft.planner.service;

import com.iimsoft.planner.domain.DateRange;
import com.iimsoft.planner.domain.ScheduleWarning;
import com.iimsoft.planner.domain.Task;
import com.iimsoft.planner.domain.WarningCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * 组任务下子任务的日期：
 * - 并行子任务都从组任务的 start 开始，end 不超过组任务的 end
 * - 顺序子任务从组任务的 start 开始首尾相接
 * 有分配器时每个子任务再单独走一遍人员分配，下一个顺序子任务接在分配后的 end 后面。
 * 分配挪动过的并行子任务重新按组任务的 end 截断；挪到组任务 end 之后的，保留截断后的天数。
 */
public class SubtaskScheduler {

    private static final Logger LOGGER = LoggerFactory.getLogger(SubtaskScheduler.class);

    // 可为 null：只排日期，不分配
    private final ResourceAllocator allocator;

    public SubtaskScheduler(ResourceAllocator allocator) {
        this.allocator = allocator;
    }

    public List<Assignment> schedule(Task group, List<Task> subtasks, WorkloadLedger ledger,
                                     List<ScheduleWarning> warnings) {
        List<Assignment> out = new ArrayList<>();
        if (subtasks == null || subtasks.isEmpty()) {
            return out;
        }
        DateRange groupDates = group.getDates();
        if (groupDates == null) {
            LOGGER.warn("{} has no dates, its {} subtasks stay unscheduled", group.getLabel(), subtasks.size());
            for (Task st : subtasks) {
                warnings.add(new ScheduleWarning(st.getId(), WarningCode.DATES_UNDETERMINED,
                        "group task " + group.getId() + " has no dates"));
            }
            return out;
        }

        LocalDate cursor = groupDates.getStart();
        for (Task st : subtasks) {
            if (!st.hasValidDuration()) {
                LOGGER.warn("Skipping subtask {}: missing or non-positive duration", st.getLabel());
                warnings.add(new ScheduleWarning(st.getId(), WarningCode.TASK_SKIPPED,
                        "missing or non-positive duration"));
                continue;
            }
            DateRange dates;
            if (st.isParallel()) {
                LocalDate end = groupDates.getStart().plusDays(st.getDuration() - 1L);
                if (end.isAfter(groupDates.getEnd())) {
                    end = groupDates.getEnd();
                }
                dates = DateRange.of(groupDates.getStart(), end);
            } else {
                dates = DateRange.ofLength(cursor, st.getDuration());
            }
            st.setDates(dates);

            if (allocator != null && st.requiresAssignment()) {
                Assignment a = allocator.assign(st, ledger, warnings);
                if (a != null) {
                    out.add(a);
                    if (st.isParallel() && a.isMoved()) {
                        st.setDates(clip(a.getDates(), groupDates, dates.calendarDays()));
                    }
                }
            }
            if (!st.isParallel()) {
                cursor = st.getEndDate().plusDays(1);
            }
        }
        LOGGER.debug("{}: scheduled {} subtasks", group.getLabel(), subtasks.size());
        return out;
    }

    static DateRange clip(DateRange moved, DateRange groupDates, int clippedDays) {
        if (!moved.getStart().isAfter(groupDates.getEnd())) {
            LocalDate end = moved.getEnd().isAfter(groupDates.getEnd()) ? groupDates.getEnd() : moved.getEnd();
            return DateRange.of(moved.getStart(), end);
        }
        LOGGER.warn("Parallel subtask moved to {}, after its group ends on {}", moved, groupDates.getEnd());
        return DateRange.ofLength(moved.getStart(), Math.min(clippedDays, moved.calendarDays()));
    }
}
