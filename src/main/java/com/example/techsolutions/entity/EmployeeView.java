package com.example.techsolutions.entity;

import java.io.PrintStream;

/**
 * Read-only access to an {@link Employee}. Holders of a view can inspect and
 * display the record but cannot mutate or release it.
 */
public interface EmployeeView {

    String getName();

    int getId();

    double getSalary();

    String getDepartment();

    void displayInfo(PrintStream out);

    default void displayInfo() {
        displayInfo(System.out);
    }
}
