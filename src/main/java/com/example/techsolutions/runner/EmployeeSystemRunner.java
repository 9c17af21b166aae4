package com.example.techsolutions.runner;

import com.example.techsolutions.entity.Employee;
import com.example.techsolutions.entity.EmployeeScope;
import com.example.techsolutions.entity.EmployeeView;
import lombok.extern.slf4j.Slf4j;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;

/**
 * Walks through the lifecycle of {@link Employee} values and prints the
 * transcript: construction, copies, passing, returning, shared count and
 * read-only access.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "employee-system.demo", name = "enabled", havingValue = "true", matchIfMissing = true)
public class EmployeeSystemRunner implements CommandLineRunner {

    private static final String RULE = "======================================";

    @Override
    public void run(String... args) {
        log.debug("Starting employee lifecycle demo");
        runDemo(System.out);
    }

    public void runDemo(PrintStream out) {
        out.println(RULE);
        out.println("   TECHSOLUTIONS EMPLOYEE SYSTEM");
        out.println(RULE);
        out.println();

        Employee.displayCompanyInfo(out);

        try (EmployeeScope scope = new EmployeeScope()) {
            section(out, "Creating Employees");
            Employee emp1 = scope.own(new Employee("Ahmed Khan", 101, 50000.0, "Engineering"));
            Employee emp2 = scope.own(new Employee("Sara Ali", 102, 55000.0, "Marketing"));

            emp1.displayInfo(out);
            emp2.displayInfo(out);

            // not owned by the scope, released explicitly below
            section(out, "Dynamic Allocation");
            Employee emp3 = new Employee("Fatima Hassan", 103, 60000.0, "Finance");
            try {
                emp3.displayInfo(out);

                section(out, "This Pointer Demo");
                out.println("Address of emp1: " + identityOf(emp1));
                out.println("This pointer: " + identityOf(emp1.getThisReference()));

                section(out, "Passing Objects");
                printEmployeeByValue(emp1, out);
                printEmployeeByReference(emp2, out);

                section(out, "Returning Object");
                Employee emp4 = scope.own(createNewEmployee("Ali Raza", 104, 52000.0, "HR"));
                emp4.displayInfo(out);

                out.println();
                out.println(RULE);
                out.println("   DEEP COPY DEMONSTRATION");
                out.println(RULE);

                Employee original = scope.own(new Employee("Zain Malik", 105, 58000.0, "IT"));
                out.println();
                out.println("Original Employee:");
                original.displayInfo(out);

                Employee deepCopy = scope.own(Employee.copyOf(original));
                out.println();
                out.println("Deep Copy Created:");
                deepCopy.displayInfo(out);

                section(out, "Modifying Original");
                original.updateName("Zain Malik (Senior)");
                original.updateSalary(65000.0);

                out.println();
                out.println("After Modification:");
                out.println();
                out.println("Original (Modified):");
                original.displayInfo(out);

                out.println();
                out.println("Deep Copy (Unchanged):");
                deepCopy.displayInfo(out);

                out.println();
                out.println("** Deep copy has independent memory **");

                section(out, "Adding New Employee");
                scope.own(new Employee("Ayesha Iqbal", 106, 54000.0, "Operations"));
                Employee.displayCompanyInfo(out);

                section(out, "Const Object");
                EmployeeView constEmp = scope.own(new Employee("Hassan Ahmed", 107, 56000.0, "QA"));
                constEmp.displayInfo(out);

                // explicit release; the finally block only covers early exits
                emp3.close();
            } finally {
                emp3.close();
            }

            section(out, "Final Statistics");
            Employee.displayCompanyInfo(out);

            out.println();
            out.println(RULE);
            out.println("   PROGRAM COMPLETED");
            out.println(RULE);
            out.println();
        }
        log.debug("Demo finished, live employees: {}", Employee.getTotalEmployees());
    }

    /**
     * Receives its own copy of the caller's employee; the copy is released
     * when this method returns.
     */
    static void printEmployeeByValue(Employee source, PrintStream out) {
        try (Employee emp = new Employee(source)) {
            out.println();
            out.println("[Passed by Value] " + emp.getName());
        }
    }

    static void printEmployeeByReference(EmployeeView emp, PrintStream out) {
        out.println();
        out.println("[Passed by Reference]");
        emp.displayInfo(out);
    }

    static Employee createNewEmployee(String name, int id, double salary, String department) {
        Employee newEmp = new Employee(name, id, salary, department);
        return newEmp;
    }

    static String identityOf(Object target) {
        return "0x" + Integer.toHexString(System.identityHashCode(target));
    }

    private static void section(PrintStream out, String title) {
        out.println();
        out.println("--- " + title + " ---");
    }
}
