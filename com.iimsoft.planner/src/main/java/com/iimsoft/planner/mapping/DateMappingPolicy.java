package com.iimsoft.planner.mapping;

import com.iimsoft.planner.calendar.WorkCalendarConfig;
import com.iimsoft.planner.domain.DateRange;
import com.iimsoft.planner.domain.Task;
import com.iimsoft.planner.service.port.PersonDirectory;

import java.time.LocalDate;

/**
 * 抽象时间（项目开始后第几个单位）-> 具体日历日期。
 *
 * earliestTime = k 表示任务开始前已经过去 k 个单位；duration 含首尾两天。
 */
public interface DateMappingPolicy {

    /**
     * @return 任务的 [start, end]；在迭代上限内排不出来时返回 null
     */
    DateRange map(Task task, int earliestTime, LocalDate projectStart);

    /**
     * 依赖校正时把任务挪到 notBefore 或之后，按任务自己的 duration 重新算 end。
     *
     * @return 新的 [start, end]；在迭代上限内排不出来时返回 null
     */
    DateRange shift(Task task, LocalDate notBefore);

    /**
     * 有人员目录时按休息日推算，否则按日历天。
     */
    static DateMappingPolicy forDirectory(PersonDirectory directory, WorkCalendarConfig config) {
        if (directory == null) {
            return new CalendarDayMappingPolicy();
        }
        return new WorkingDayMappingPolicy(directory, config);
    }
}
