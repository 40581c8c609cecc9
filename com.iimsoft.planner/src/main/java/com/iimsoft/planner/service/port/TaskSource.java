package com.iimsoft.planner.service.port;

import com.iimsoft.planner.domain.Task;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * 任务存储。排程只通过这个接口读写任务，不关心底层是数据库还是内存。
 */
public interface TaskSource {

    /** 项目下的顶层任务（parentId 为空），按存储顺序 */
    List<Task> listTasks(Long projectId);

    /** 不存在时返回 null */
    Task getTask(Long taskId);

    List<Task> getSubtasks(Long parentId);

    boolean updateTaskDates(Long taskId, LocalDate start, LocalDate end);

    /** personId 为 null 表示取消分配 */
    boolean assignPerson(Long taskId, Long personId);

    /** 顶层任务 + 每个组任务的子任务，子任务紧跟在所属组任务后面 */
    default List<Task> listAllTasks(Long projectId) {
        List<Task> out = new ArrayList<>();
        for (Task task : listTasks(projectId)) {
            out.add(task);
            if (task.isGroup()) {
                out.addAll(getSubtasks(task.getId()));
            }
        }
        return out;
    }
}
