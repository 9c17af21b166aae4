package com.example.techsolutions.entity;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Owns employees created inside a block and releases them in reverse order
 * of creation when the block exits.
 */
public class EmployeeScope implements AutoCloseable {

    private final Deque<Employee> owned = new ArrayDeque<>();

    public Employee own(Employee employee) {
        owned.push(employee);
        return employee;
    }

    public int size() {
        return owned.size();
    }

    @Override
    public void close() {
        while (!owned.isEmpty()) {
            owned.pop().close();
        }
    }
}
