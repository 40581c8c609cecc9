package com.iimsoft.planner.service;

import com.iimsoft.planner.domain.DateRange;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class Assignment {
    Long taskId;
    Long personId;
    DateRange dates;
    // 为了找到可用窗口而改过日期
    boolean moved;
}
