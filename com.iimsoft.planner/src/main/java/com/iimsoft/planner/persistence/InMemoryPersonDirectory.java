package com.iimsoft.planner.persistence;

import com.iimsoft.planner.domain.Person;
import com.iimsoft.planner.service.port.PersonDirectory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 内存版人员目录，listByRole 按添加顺序返回。
 */
public class InMemoryPersonDirectory implements PersonDirectory {

    private final Map<Long, Person> persons = new LinkedHashMap<>();

    public InMemoryPersonDirectory add(Person person) {
        Objects.requireNonNull(person.getId(), "person.id");
        persons.put(person.getId(), person);
        return this;
    }

    public boolean isEmpty() {
        return persons.isEmpty();
    }

    @Override
    public List<Person> listByRole(String role) {
        List<Person> out = new ArrayList<>();
        if (role == null) {
            return out;
        }
        for (Person p : persons.values()) {
            if (p.getPosition() != null && p.getPosition().trim().equals(role.trim())) {
                out.add(p);
            }
        }
        return out;
    }

    @Override
    public Person getPerson(Long personId) {
        return persons.get(personId);
    }
}
