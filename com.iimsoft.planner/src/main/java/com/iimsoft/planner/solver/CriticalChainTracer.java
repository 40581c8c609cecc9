package com.iimsoft.planner.solver;

import com.iimsoft.planner.domain.DateRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 按实际日期回溯关键链：从最晚结束的任务开始，每一步取结束最晚的前置任务，直到没有前置。
 *
 * 和 {@link PathAnalysis#getCriticalTaskIds()} 不同，这里的结果按时间先后排列，
 * 反映的是校正 / 分配之后的日期，而不是抽象时间轴。
 */
public class CriticalChainTracer {

    /**
     * @param dates        已排出日期的任务；没有日期的任务不参与
     * @param dependencies 任务 -> 前置任务
     * @return 从头到尾的任务 id，dates 为空时返回空列表
     */
    public List<Long> trace(Map<Long, DateRange> dates, Map<Long, List<Long>> dependencies) {
        if (dates == null || dates.isEmpty()) {
            return new ArrayList<>();
        }

        Long current = null;
        DateRange currentRange = null;
        for (Map.Entry<Long, DateRange> e : dates.entrySet()) {
            if (currentRange == null || e.getValue().getEnd().isAfter(currentRange.getEnd())) {
                current = e.getKey();
                currentRange = e.getValue();
            }
        }

        List<Long> chain = new ArrayList<>();
        Set<Long> visited = new HashSet<>();
        while (current != null && visited.add(current)) {
            chain.add(current);
            Long next = null;
            DateRange nextRange = null;
            for (Long pred : dependencies.getOrDefault(current, List.of())) {
                DateRange r = dates.get(pred);
                if (r == null || visited.contains(pred)) {
                    continue;
                }
                if (nextRange == null || r.getEnd().isAfter(nextRange.getEnd())) {
                    next = pred;
                    nextRange = r;
                }
            }
            current = next;
        }
        Collections.reverse(chain);
        return chain;
    }
}
