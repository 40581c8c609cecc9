package com.iimsoft.planner.domain;

import com.iimsoft.planner.calendar.WorkCalendar;

import java.time.LocalDate;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 可分配的人员。由外部人员目录创建，排程过程中只读。
 */
public class Person {

    private Long id;
    private String name;
    private String position;

    // 每周休息日 1=周一 ... 7=周日
    private Set<Integer> daysOff = new LinkedHashSet<>();

    public Person() {
    }

    public Person(Long id, String name, String position, Collection<Integer> daysOff) {
        this.id = id;
        this.name = name;
        this.position = position;
        setDaysOff(daysOff);
    }

    public boolean isAvailable(LocalDate date) {
        return !daysOff.contains(WorkCalendar.isoWeekday(date));
    }

    public WorkCalendar toWorkCalendar() {
        return WorkCalendar.of(daysOff);
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getPosition() { return position; }
    public void setPosition(String position) { this.position = position; }
    public Set<Integer> getDaysOff() { return daysOff; }

    public void setDaysOff(Collection<Integer> daysOff) {
        this.daysOff = daysOff == null ? new LinkedHashSet<>() : new LinkedHashSet<>(daysOff);
    }

    @Override
    public String toString() {
        return "Person{" + id + " " + name + ", " + position + ", daysOff=" + daysOff + "}";
    }
}
