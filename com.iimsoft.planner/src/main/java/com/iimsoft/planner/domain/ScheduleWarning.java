package com.iimsoft.planner.domain;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ScheduleWarning {
    Long taskId;
    WarningCode code;
    String message;
}
