package com.example.techsolutions.entity;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.PrintStream;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * One employment record of the company.
 *
 * <p>Every constructed or copied instance counts as live until {@link #close()}
 * is called on it. {@code id} and {@code department} are fixed at construction.
 * Copies never share mutable state with their source.
 */
@Slf4j
@Getter
public class Employee implements EmployeeView, AutoCloseable {

    public static final String COMPANY_NAME = "TechSolutions";

    private static final MathContext SALARY_PRECISION = new MathContext(6, RoundingMode.HALF_EVEN);

    // live instances: +1 per construction or copy, -1 per release
    private static int employeeCount = 0;

    private String name;
    private final int id;
    private double salary;
    private final String department;

    @Getter(AccessLevel.NONE)
    private boolean released;

    public Employee(String name, int id, double salary, String department) {
        this.name = name;
        this.id = id;
        this.salary = salary;
        this.department = department;
        employeeCount++;
        log.info("Employee created: {}", name);
    }

    public Employee(Employee source) {
        this.name = source.name;
        this.id = source.id;
        this.salary = source.salary;
        this.department = source.department;
        log.info("Creating deep copy of: {}", source.name);
        employeeCount++;
    }

    public static Employee copyOf(Employee source) {
        return new Employee(source);
    }

    /**
     * Releases this instance. Only the first call decrements the live count.
     */
    @Override
    public void close() {
        if (released) {
            return;
        }
        released = true;
        log.info("Destroying employee: {}", name);
        employeeCount--;
    }

    public boolean isReleased() {
        return released;
    }

    @Override
    public void displayInfo(PrintStream out) {
        out.println();
        out.println("--- Employee Details ---");
        out.println("Company: " + COMPANY_NAME);
        out.println("Name: " + name);
        out.println("ID: " + id);
        out.println("Department: " + department);
        out.println("Salary: $" + formatSalary(salary));
    }

    public Employee getThisReference() {
        return this;
    }

    public void updateSalary(double newSalary) {
        this.salary = newSalary;
    }

    public void updateName(String newName) {
        this.name = newName;
    }

    public static void displayCompanyInfo() {
        displayCompanyInfo(System.out);
    }

    public static void displayCompanyInfo(PrintStream out) {
        out.println();
        out.println("=== Company Information ===");
        out.println("Company: " + COMPANY_NAME);
        out.println("Total Employees: " + employeeCount);
    }

    public static int getTotalEmployees() {
        return employeeCount;
    }

    /**
     * Renders a salary the way a default-precision output stream does: six
     * significant digits of the exact binary value rounded half-to-even,
     * trailing zeros dropped, and exponent form once the decimal exponent is
     * below -4 or at least 6. 50000.0 prints as {@code 50000}, 1234567.0 as
     * {@code 1.23457e+06}.
     */
    static String formatSalary(double salary) {
        if (Double.isNaN(salary)) {
            return "nan";
        }
        if (Double.isInfinite(salary)) {
            return salary > 0 ? "inf" : "-inf";
        }
        if (salary == 0.0) {
            return Double.doubleToRawLongBits(salary) < 0 ? "-0" : "0";
        }
        BigDecimal rounded = new BigDecimal(salary).round(SALARY_PRECISION);
        int exponent = rounded.precision() - rounded.scale() - 1;
        if (exponent < -4 || exponent >= SALARY_PRECISION.getPrecision()) {
            String mantissa = rounded.movePointLeft(exponent).stripTrailingZeros().toPlainString();
            return String.format(Locale.ROOT, "%se%c%02d", mantissa, exponent < 0 ? '-' : '+', Math.abs(exponent));
        }
        return rounded.stripTrailingZeros().toPlainString();
    }

    @Override
    public String toString() {
        return name;
    }
}
