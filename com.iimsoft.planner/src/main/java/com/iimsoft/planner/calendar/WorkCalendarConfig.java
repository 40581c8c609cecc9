package com.iimsoft.planner.calendar;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * 排程日历配置：公司默认休息日 + 各种搜索上限。
 *
 * 配置来源（优先级从高到低）：
 * 1) JVM 参数：-Dwork.calendar=JSON
 * 2) classpath 资源 work-calendar.json
 * 3) 默认：周六、周日休息，可用窗口最多向后找 60 天
 *
 * 任何一层解析失败都回退到下一层，不会让排程直接挂掉。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkCalendarConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(WorkCalendarConfig.class);

    /** JVM 参数 key */
    public static final String WORK_CALENDAR_JSON_PROPERTY = "work.calendar";

    /** classpath 配置文件 */
    public static final String WORK_CALENDAR_RESOURCE = "work-calendar.json";

    public static final List<Integer> DEFAULT_CORPORATE_DAYS_OFF = List.of(6, 7);
    public static final int DEFAULT_SEARCH_HORIZON_DAYS = 60;
    public static final int DEFAULT_ITERATION_CAP_FACTOR = 3;
    public static final int DEFAULT_MINIMUM_ITERATION_CAP = 14;

    /** 1=周一 ... 7=周日 */
    @JsonProperty("corporateDaysOff")
    private List<Integer> corporateDaysOff;

    @JsonProperty("availabilitySearchHorizonDays")
    private int availabilitySearchHorizonDays;

    @JsonProperty("iterationCapFactor")
    private int iterationCapFactor;

    @JsonProperty("minimumIterationCap")
    private int minimumIterationCap;

    public WorkCalendarConfig() {
        this.corporateDaysOff = new ArrayList<>(DEFAULT_CORPORATE_DAYS_OFF);
        this.availabilitySearchHorizonDays = DEFAULT_SEARCH_HORIZON_DAYS;
        this.iterationCapFactor = DEFAULT_ITERATION_CAP_FACTOR;
        this.minimumIterationCap = DEFAULT_MINIMUM_ITERATION_CAP;
    }

    public static WorkCalendarConfig defaults() {
        return new WorkCalendarConfig();
    }

    public static WorkCalendarConfig load() {
        ObjectMapper mapper = new ObjectMapper();

        String json = System.getProperty(WORK_CALENDAR_JSON_PROPERTY);
        if (json != null && !json.isBlank()) {
            try {
                return mapper.readValue(json, WorkCalendarConfig.class).sanitized();
            } catch (Exception e) {
                LOGGER.warn("Invalid -D{} value, falling back to {}: {}",
                        WORK_CALENDAR_JSON_PROPERTY, WORK_CALENDAR_RESOURCE, e.getMessage());
            }
        }

        try (InputStream in = WorkCalendarConfig.class.getClassLoader().getResourceAsStream(WORK_CALENDAR_RESOURCE)) {
            if (in != null) {
                return mapper.readValue(in, WorkCalendarConfig.class).sanitized();
            }
        } catch (Exception e) {
            LOGGER.warn("Unreadable {} on classpath, using built-in defaults: {}",
                    WORK_CALENDAR_RESOURCE, e.getMessage());
        }
        return defaults();
    }

    /**
     * 校验配置值，非法的项逐个回退默认值。
     */
    public WorkCalendarConfig sanitized() {
        if (corporateDaysOff == null
                || corporateDaysOff.stream().anyMatch(d -> d == null || d < 1 || d > 7)) {
            LOGGER.warn("corporateDaysOff {} is not a list of weekdays 1..7, using {}",
                    corporateDaysOff, DEFAULT_CORPORATE_DAYS_OFF);
            corporateDaysOff = new ArrayList<>(DEFAULT_CORPORATE_DAYS_OFF);
        }
        if (availabilitySearchHorizonDays <= 0) {
            availabilitySearchHorizonDays = DEFAULT_SEARCH_HORIZON_DAYS;
        }
        if (iterationCapFactor <= 0) {
            iterationCapFactor = DEFAULT_ITERATION_CAP_FACTOR;
        }
        if (minimumIterationCap <= 0) {
            minimumIterationCap = DEFAULT_MINIMUM_ITERATION_CAP;
        }
        return this;
    }

    /** 公司默认日历 */
    public WorkCalendar corporateCalendar() {
        return WorkCalendar.of(corporateDaysOff);
    }

    /**
     * 日期推算的迭代上限：至少 units * factor，且不低于 minimumIterationCap。
     */
    public int iterationCapFor(int units) {
        long cap = (long) Math.max(units, 1) * iterationCapFactor;
        return (int) Math.min(Integer.MAX_VALUE, Math.max(cap, minimumIterationCap));
    }

    /**
     * 按日历每周工作天数放大：每周只上 1 天班的人，凑 units 个工作日要 7 倍的日历天。
     */
    public int iterationCapFor(int units, WorkCalendar calendar) {
        int base = iterationCapFor(units);
        int perWeek = calendar == null ? 7 : calendar.workingDaysPerWeek();
        if (perWeek <= 0 || perWeek >= 7) {
            return base;
        }
        long scaled = ((long) base * 7 + perWeek - 1) / perWeek;
        return (int) Math.min(Integer.MAX_VALUE, scaled);
    }

    public List<Integer> getCorporateDaysOff() {
        return corporateDaysOff;
    }

    public void setCorporateDaysOff(List<Integer> corporateDaysOff) {
        this.corporateDaysOff = corporateDaysOff;
    }

    public int getAvailabilitySearchHorizonDays() {
        return availabilitySearchHorizonDays;
    }

    public void setAvailabilitySearchHorizonDays(int availabilitySearchHorizonDays) {
        this.availabilitySearchHorizonDays = availabilitySearchHorizonDays;
    }

    public int getIterationCapFactor() {
        return iterationCapFactor;
    }

    public void setIterationCapFactor(int iterationCapFactor) {
        this.iterationCapFactor = iterationCapFactor;
    }

    public int getMinimumIterationCap() {
        return minimumIterationCap;
    }

    public void setMinimumIterationCap(int minimumIterationCap) {
        this.minimumIterationCap = minimumIterationCap;
    }
}
