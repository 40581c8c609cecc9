package com.iimsoft.planner.service;

import com.iimsoft.planner.calendar.WorkCalendarConfig;
import com.iimsoft.planner.domain.DateRange;
import com.iimsoft.planner.domain.Person;
import com.iimsoft.planner.domain.ScheduleWarning;
import com.iimsoft.planner.domain.Task;
import com.iimsoft.planner.domain.WarningCode;
import com.iimsoft.planner.service.port.PersonDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 人员分配（贪心，先到先得，不回溯）。
 *
 * 任务按 start 排序（相同 start 保持输入顺序），对每个需要岗位的非组任务：
 * 1) 已指派的人在 [start, end] 每天都可用：保留，累计负载
 * 2) 按岗位查候选人，没有候选人：告警跳过
 * 3) 负载低的优先，找第一个在当前日期上可用的人，不动日期
 * 4) 都不可用：负载低的优先，从 start 往后找连续 duration 天都可用的窗口，找到就分配并改日期
 *
 * 原负责人不可用且没找到替代的人时，任务变成未分配（employeeId 清空）。
 */
public class ResourceAllocator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResourceAllocator.class);

    private final PersonDirectory directory;
    private final int searchHorizonDays;

    public ResourceAllocator(PersonDirectory directory, WorkCalendarConfig config) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.searchHorizonDays = (config == null ? WorkCalendarConfig.defaults() : config)
                .getAvailabilitySearchHorizonDays();
    }

    public List<Assignment> allocate(List<Task> tasks, WorkloadLedger ledger, List<ScheduleWarning> warnings) {
        List<Task> ordered = new ArrayList<>();
        for (Task task : tasks) {
            if (!task.requiresAssignment()) {
                continue;
            }
            if (task.getDates() == null) {
                LOGGER.debug("{} has no dates, skipping allocation", task.getLabel());
                continue;
            }
            ordered.add(task);
        }
        // List.sort 是稳定排序
        ordered.sort(Comparator.comparing(Task::getStartDate));

        List<Assignment> out = new ArrayList<>();
        for (Task task : ordered) {
            Assignment a = assign(task, ledger, warnings);
            if (a != null) {
                out.add(a);
            }
        }
        return out;
    }

    /**
     * 单个任务走一遍 1~4 步，成功时改写 task 的 employeeId（以及第 4 步的日期）。
     *
     * @return 分配结果；没有分配成功返回 null
     */
    public Assignment assign(Task task, WorkloadLedger ledger, List<ScheduleWarning> warnings) {
        DateRange dates = task.getDates();
        if (dates == null || !task.hasValidDuration()) {
            return null;
        }
        int duration = task.getDuration();

        // 1) 已指派
        if (task.getEmployeeId() != null) {
            Person assigned = directory.getPerson(task.getEmployeeId());
            if (assigned == null) {
                LOGGER.warn("{}: assigned person {} not found, reassigning", task.getLabel(), task.getEmployeeId());
                warnings.add(new ScheduleWarning(task.getId(), WarningCode.PERSON_NOT_FOUND,
                        "assigned person " + task.getEmployeeId() + " not found"));
            } else if (isAvailable(assigned, dates)) {
                ledger.add(assigned.getId(), duration);
                return new Assignment(task.getId(), assigned.getId(), dates, false);
            } else {
                LOGGER.info("{}: {} is not available on {}, reassigning", task.getLabel(), assigned.getName(), dates);
            }
        }

        // 2) 候选人
        List<Person> eligible = directory.listByRole(task.getPosition());
        if (eligible == null || eligible.isEmpty()) {
            LOGGER.warn("{}: nobody holds role '{}', left unassigned", task.getLabel(), task.getPosition());
            warnings.add(new ScheduleWarning(task.getId(), WarningCode.NO_ELIGIBLE_PERSON,
                    "no person with role " + task.getPosition() + releaseNote(task)));
            release(task);
            return null;
        }
        List<Person> candidates = ledger.leastLoadedFirst(eligible);

        // 3) 当前日期
        for (Person p : candidates) {
            if (isAvailable(p, dates)) {
                return commit(task, p, dates, false, ledger);
            }
        }

        // 4) 往后找窗口
        for (Person p : candidates) {
            LocalDate windowStart = p.toWorkCalendar().findContiguousWindow(dates.getStart(), duration, searchHorizonDays);
            if (windowStart != null) {
                DateRange window = DateRange.ofLength(windowStart, duration);
                LOGGER.info("{} moved {} -> {} to fit {}", task.getLabel(), dates, window, p.getName());
                task.setDates(window);
                return commit(task, p, window, true, ledger);
            }
        }

        LOGGER.warn("{}: no '{}' available within {} days after {}, left unassigned",
                task.getLabel(), task.getPosition(), searchHorizonDays, dates.getStart());
        warnings.add(new ScheduleWarning(task.getId(), WarningCode.NO_AVAILABLE_WINDOW,
                "no available window within " + searchHorizonDays + " days" + releaseNote(task)));
        release(task);
        return null;
    }

    private static String releaseNote(Task task) {
        return task.getEmployeeId() == null ? "" : ", previous assignee " + task.getEmployeeId() + " released";
    }

    private static void release(Task task) {
        if (task.getEmployeeId() != null) {
            LOGGER.info("{}: person {} released, task is unassigned", task.getLabel(), task.getEmployeeId());
            task.setEmployeeId(null);
        }
    }

    private Assignment commit(Task task, Person person, DateRange dates, boolean moved, WorkloadLedger ledger) {
        task.setEmployeeId(person.getId());
        ledger.add(person.getId(), task.getDuration());
        LOGGER.info("{} assigned to {} ({})", task.getLabel(), person.getName(), dates);
        return new Assignment(task.getId(), person.getId(), dates, moved);
    }

    /** [start, end] 的每一个日历天都不是此人的休息日 */
    static boolean isAvailable(Person person, DateRange dates) {
        for (LocalDate d = dates.getStart(); !d.isAfter(dates.getEnd()); d = d.plusDays(1)) {
            if (!person.isAvailable(d)) {
                LOGGER.debug("{} is off on {}", person.getName(), d);
                return false;
            }
        }
        return true;
    }
}
