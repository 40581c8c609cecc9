package com.iimsoft.planner.graph;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * 新增依赖前的校验：taskId 依赖 predecessorId 是否会形成环。
 */
public final class DependencyValidator {

    private DependencyValidator() {
    }

    /**
     * @param dependencies 任务 -> 它的前置任务
     */
    public static boolean wouldCreateCycle(Long taskId, Long predecessorId,
                                           Map<Long, ? extends Collection<Long>> dependencies) {
        if (taskId == null || predecessorId == null) {
            return false;
        }
        if (taskId.equals(predecessorId)) {
            return true;
        }
        // 沿 predecessorId 的前置链往上走，碰到 taskId 就成环
        Deque<Long> stack = new ArrayDeque<>();
        Set<Long> seen = new HashSet<>();
        stack.push(predecessorId);
        while (!stack.isEmpty()) {
            Long current = stack.pop();
            if (!seen.add(current)) {
                continue;
            }
            Collection<Long> preds = dependencies.get(current);
            if (preds == null) {
                continue;
            }
            for (Long p : preds) {
                if (taskId.equals(p)) {
                    return true;
                }
                stack.push(p);
            }
        }
        return false;
    }
}
