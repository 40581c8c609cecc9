package com.iimsoft.planner.mapping;

import com.iimsoft.planner.calendar.WorkCalendar;
import com.iimsoft.planner.calendar.WorkCalendarConfig;
import com.iimsoft.planner.domain.DateRange;
import com.iimsoft.planner.domain.Person;
import com.iimsoft.planner.domain.Task;
import com.iimsoft.planner.service.port.PersonDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.Objects;

/**
 * 跳过休息日的推算：
 * - 休息日：已分配且能查到人、人的休息日非空时用个人的，否则用公司默认日历
 * - start：项目开始日当天或之后的第一个工作日，再往后跳 k 个工作日
 * - end：从 start 起（start 算第 1 天）数满 duration 个工作日
 *
 * 两步都有迭代上限（见 {@link WorkCalendarConfig#iterationCapFor(int, WorkCalendar)}），超出返回 null。
 */
public class WorkingDayMappingPolicy implements DateMappingPolicy {

    private static final Logger LOGGER = LoggerFactory.getLogger(WorkingDayMappingPolicy.class);

    private final PersonDirectory directory;
    private final WorkCalendarConfig config;

    public WorkingDayMappingPolicy(PersonDirectory directory, WorkCalendarConfig config) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.config = config == null ? WorkCalendarConfig.defaults() : config;
    }

    @Override
    public DateRange map(Task task, int earliestTime, LocalDate projectStart) {
        if (!task.hasValidDuration()) {
            return null;
        }
        WorkCalendar calendar = calendarFor(task);
        if (!calendar.hasWorkingDays()) {
            LOGGER.warn("{}: calendar {} has no working day", task.getLabel(), calendar);
            return null;
        }

        LocalDate firstWorkingDay = calendar.nextWorkingDay(projectStart);
        LocalDate start = calendar.skipWorkingDays(firstWorkingDay, earliestTime,
                config.iterationCapFor(earliestTime, calendar));
        if (start == null) {
            LOGGER.warn("{}: could not skip {} working days from {} within the iteration cap",
                    task.getLabel(), earliestTime, firstWorkingDay);
            return null;
        }

        int duration = task.getDuration();
        LocalDate end = calendar.endOfWorkingSpan(start, duration, config.iterationCapFor(duration, calendar));
        if (end == null) {
            LOGGER.warn("{}: could not fit {} working days from {} within the iteration cap",
                    task.getLabel(), duration, start);
            return null;
        }
        return DateRange.of(start, end);
    }

    /**
     * start 取 notBefore 当天或之后的第一个工作日，end 从 start 数满 duration 个工作日。
     */
    @Override
    public DateRange shift(Task task, LocalDate notBefore) {
        if (!task.hasValidDuration()) {
            return null;
        }
        WorkCalendar calendar = calendarFor(task);
        LocalDate start = calendar.nextWorkingDay(notBefore);
        if (start == null) {
            LOGGER.warn("{}: calendar {} has no working day", task.getLabel(), calendar);
            return null;
        }
        LocalDate end = calendar.endOfWorkingSpan(start, task.getDuration(), config.iterationCapFor(task.getDuration(), calendar));
        if (end == null) {
            LOGGER.warn("{}: could not fit {} working days from {} within the iteration cap",
                    task.getLabel(), task.getDuration(), start);
            return null;
        }
        return DateRange.of(start, end);
    }

    public WorkCalendar calendarFor(Task task) {
        if (task.getEmployeeId() != null) {
            Person person = directory.getPerson(task.getEmployeeId());
            if (person != null && !person.getDaysOff().isEmpty()) {
                return person.toWorkCalendar();
            }
        }
        return config.corporateCalendar();
    }
}
