package com.example.Attrition.ingestion;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Column set and field limits an attendance upload is checked against.
 */
public final class AttendanceRules {

    public static final String EMPLOYEE_ID = "employee_id";
    public static final String EMPLOYEE_NAME = "employee_name";
    public static final String DATE = "date";
    public static final String STATUS = "status";
    public static final String INFORMED_TIME = "informed_time";
    public static final String DEPARTMENT = "department";
    public static final String MANAGER_EMAIL = "manager_email";

    public static final List<String> REQUIRED_COLUMNS = List.of(
            EMPLOYEE_ID,
            EMPLOYEE_NAME,
            DATE,
            STATUS,
            INFORMED_TIME,
            DEPARTMENT,
            MANAGER_EMAIL
    );

    public static final List<String> SUPPORTED_EXTENSIONS = List.of("csv", "xlsx", "xls");

    public static final int EMPLOYEE_ID_MAX_LENGTH = 20;
    public static final int EMPLOYEE_NAME_MAX_LENGTH = 100;
    public static final int DEPARTMENT_MAX_LENGTH = 50;

    public static final Pattern EMAIL_PATTERN = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    public static final long UNPLANNED_NOTICE_WINDOW_HOURS = 24;

    // ~63 working days in 3 months of 5-day weeks, with tolerance
    public static final int DEFAULT_MIN_DAYS_PER_EMPLOYEE = 55;
    public static final int DEFAULT_MAX_DAYS_PER_EMPLOYEE = 70;

    private AttendanceRules() {
    }
}
