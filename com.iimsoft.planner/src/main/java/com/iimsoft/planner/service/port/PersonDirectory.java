package com.iimsoft.planner.service.port;

import com.iimsoft.planner.domain.Person;

import java.time.LocalDate;
import java.util.List;

/**
 * 人员目录。listByRole 的返回顺序就是负载相同时的优先顺序。
 */
public interface PersonDirectory {

    List<Person> listByRole(String role);

    /** 不存在时返回 null */
    Person getPerson(Long personId);

    /** 人员不存在时视为不可用 */
    default boolean isAvailable(Long personId, LocalDate date) {
        Person person = getPerson(personId);
        return person != null && person.isAvailable(date);
    }
}
