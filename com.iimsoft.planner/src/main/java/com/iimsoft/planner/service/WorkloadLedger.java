package com.iimsoft.planner.service;

import com.iimsoft.planner.domain.Person;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次排程内每个人已分配的天数（任务 duration 之和）。每次排程各用一个，不跨排程共享。
 */
public class WorkloadLedger {

    private final Map<Long, Integer> daysByPerson = new LinkedHashMap<>();

    public void add(Long personId, int days) {
        daysByPerson.merge(personId, days, Integer::sum);
    }

    public int loadOf(Long personId) {
        return daysByPerson.getOrDefault(personId, 0);
    }

    /** 负载从低到高；负载相同保持原顺序 */
    public List<Person> leastLoadedFirst(List<Person> persons) {
        List<Person> sorted = new ArrayList<>(persons);
        sorted.sort(Comparator.comparingInt(p -> loadOf(p.getId())));
        return sorted;
    }

    public Map<Long, Integer> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(daysByPerson));
    }
}
