package com.iimsoft.planner.mapping;

import com.iimsoft.planner.domain.DateRange;
import com.iimsoft.planner.domain.ScheduleWarning;
import com.iimsoft.planner.domain.Task;
import com.iimsoft.planner.domain.WarningCode;
import com.iimsoft.planner.graph.DependencyGraph;
import com.iimsoft.planner.solver.PathAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 把最长路结果映射成每个任务的日历日期。只处理进了依赖图的任务。
 */
public class CalendarMapper {

    private static final Logger LOGGER = LoggerFactory.getLogger(CalendarMapper.class);

    private final DateMappingPolicy policy;

    public CalendarMapper(DateMappingPolicy policy) {
        this.policy = policy;
    }

    /**
     * @return taskId -> [start, end]，按任务输入顺序；推不出日期的任务不在结果里
     */
    public Map<Long, DateRange> map(List<Task> tasks, DependencyGraph graph, PathAnalysis analysis,
                                    LocalDate projectStart, List<ScheduleWarning> warnings) {
        Map<Long, DateRange> dates = new LinkedHashMap<>();
        for (Task task : tasks) {
            if (task.getId() == null || graph.nodeOf(task.getId()) == null || dates.containsKey(task.getId())) {
                continue;
            }
            int earliest = analysis.earlyTimeOf(graph, task.getId());
            DateRange range = policy.map(task, earliest, projectStart);
            if (range == null) {
                warnings.add(new ScheduleWarning(task.getId(), WarningCode.DATES_UNDETERMINED,
                        "no dates within the iteration cap"));
                continue;
            }
            dates.put(task.getId(), range);
        }
        LOGGER.debug("Mapped {} of {} graph tasks to dates", dates.size(), graph.getNodeByTask().size());
        return dates;
    }
}
