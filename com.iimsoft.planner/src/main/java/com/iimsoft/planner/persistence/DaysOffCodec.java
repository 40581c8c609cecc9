package com.iimsoft.planner.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.iimsoft.planner.domain.Person;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * 人员休息日字段（1=周一 ... 7=周日），格式同 {@link PredecessorCodec}。
 */
public final class DaysOffCodec {

    private static final Logger LOGGER = LoggerFactory.getLogger(DaysOffCodec.class);

    private DaysOffCodec() {
    }

    /**
     * @throws IllegalArgumentException 无法解析或不在 1..7
     */
    public static LinkedHashSet<Integer> decode(JsonNode raw) {
        LinkedHashSet<Integer> out = new LinkedHashSet<>();
        for (Long d : PredecessorCodec.parseIds(raw)) {
            if (d < 1 || d > 7) {
                throw new IllegalArgumentException("weekday out of range 1..7: " + d);
            }
            out.add(d.intValue());
        }
        return out;
    }

    /**
     * 解析失败时休息日为空（排程回退到公司默认日历）。
     */
    public static void applyTo(Person person, JsonNode raw) {
        try {
            person.setDaysOff(decode(raw));
        } catch (IllegalArgumentException e) {
            LOGGER.warn("{}: unparseable days off {} ({}), using none", person, raw, e.getMessage());
            person.setDaysOff(null);
        }
    }

    public static String encode(Collection<Integer> daysOff) {
        List<Integer> days = new ArrayList<>(new LinkedHashSet<>(daysOff == null ? List.of() : daysOff));
        try {
            return PredecessorCodec.MAPPER.writeValueAsString(days);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode days off " + days, e);
        }
    }
}
