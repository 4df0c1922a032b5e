package com.example.Attrition.ingestion;

import com.example.Attrition.ingestion.reader.TabularRow;
import com.example.Attrition.model.AttendanceRecord;
import com.example.Attrition.model.AttendanceStatus;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.example.Attrition.ingestion.AttendanceRules.*;

/**
 * Applies the per-row attendance rules. Every rule is evaluated for every row so a
 * rejected row reports all of its problems at once. Rows are processed in file order:
 * the first row with a given employee and date claims that key, later ones are duplicates.
 */
@Slf4j
@Component
public class AttendanceRowValidator {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd")
            .withResolverStyle(ResolverStyle.STRICT);

    private static final String VALID_STATUS_LABELS = Arrays.stream(AttendanceStatus.values())
            .map(AttendanceStatus::getLabel)
            .collect(Collectors.joining(", "));

    private final ZoneId zone;

    public AttendanceRowValidator(ZoneId attritionZone) {
        this.zone = attritionZone;
    }

    @Value
    public static class Outcome {
        List<AttendanceRecord> validRecords;
        List<ValidationError> rowErrors;
    }

    public Outcome validate(List<TabularRow> rows) {
        List<AttendanceRecord> valid = new ArrayList<>();
        List<ValidationError> errors = new ArrayList<>();
        Set<String> seenKeys = new HashSet<>();

        for (TabularRow row : rows) {
            List<FieldViolation> violations = new ArrayList<>();

            String employeeId = row.get(EMPLOYEE_ID);
            String employeeName = row.get(EMPLOYEE_NAME);
            String rawDate = row.get(DATE);
            String rawStatus = row.get(STATUS);
            String rawInformed = row.get(INFORMED_TIME);
            String department = row.get(DEPARTMENT);
            String managerEmail = row.get(MANAGER_EMAIL);

            checkText(EMPLOYEE_ID, employeeId, EMPLOYEE_ID_MAX_LENGTH, violations);
            checkText(EMPLOYEE_NAME, employeeName, EMPLOYEE_NAME_MAX_LENGTH, violations);

            LocalDate date = parseDate(rawDate, violations);

            AttendanceStatus status = AttendanceStatus.fromLabel(rawStatus).orElse(null);
            if (status == null) {
                violations.add(FieldViolation.of(STATUS, ViolationCode.INVALID_STATUS,
                        "status must be one of: " + VALID_STATUS_LABELS, rawStatus));
            }

            Instant informedTime = checkInformedTime(status, date, rawInformed, violations);

            checkText(DEPARTMENT, department, DEPARTMENT_MAX_LENGTH, violations);

            if (isBlank(managerEmail) || !EMAIL_PATTERN.matcher(managerEmail).matches()) {
                violations.add(FieldViolation.of(MANAGER_EMAIL, ViolationCode.INVALID_EMAIL,
                        "manager_email must be a valid email address", managerEmail));
            }

            if (!isBlank(employeeId) && !isBlank(rawDate)) {
                String key = employeeId + "_" + rawDate;
                if (!seenKeys.add(key)) {
                    violations.add(FieldViolation.of(EMPLOYEE_ID + "+" + DATE, ViolationCode.DUPLICATE,
                            "duplicate employee_id + date combination", key));
                }
            }

            if (!violations.isEmpty()) {
                log.debug("Row {} rejected with {} violation(s)", row.getRowNumber(), violations.size());
                errors.add(ValidationError.row(row.getRowNumber(), violations));
                continue;
            }

            valid.add(AttendanceRecord.builder()
                    .employeeId(employeeId)
                    .employeeName(employeeName)
                    .date(date)
                    .status(status)
                    .informedTime(status.isLeave() ? informedTime : null)
                    .department(department)
                    .managerEmail(managerEmail.toLowerCase(Locale.ROOT))
                    .build());
        }

        return new Outcome(valid, errors);
    }

    private void checkText(String field, String value, int maxLength, List<FieldViolation> violations) {
        if (isBlank(value)) {
            violations.add(FieldViolation.of(field, ViolationCode.REQUIRED, field + " is required", null));
        } else if (value.length() > maxLength) {
            violations.add(FieldViolation.of(field, ViolationCode.TOO_LONG,
                    field + " must be max " + maxLength + " characters", value));
        }
    }

    private LocalDate parseDate(String raw, List<FieldViolation> violations) {
        LocalDate date;
        try {
            date = LocalDate.parse(raw == null ? "" : raw, DATE_FORMAT);
        } catch (DateTimeParseException e) {
            violations.add(FieldViolation.of(DATE, ViolationCode.INVALID_FORMAT,
                    "date must be in YYYY-MM-DD format", raw));
            return null;
        }
        if (date.getDayOfWeek() == DayOfWeek.SATURDAY || date.getDayOfWeek() == DayOfWeek.SUNDAY) {
            violations.add(FieldViolation.of(DATE, ViolationCode.WEEKEND_DATE,
                    "date cannot be a weekend (Saturday/Sunday)", raw));
        }
        return date;
    }

    private Instant checkInformedTime(AttendanceStatus status, LocalDate date, String raw,
                                      List<FieldViolation> violations) {
        boolean leave = status != null && status.isLeave();
        if (isBlank(raw)) {
            if (leave) {
                violations.add(FieldViolation.of(INFORMED_TIME, ViolationCode.REQUIRED,
                        "informed_time is required for leave records", null));
            }
            return null;
        }

        Optional<Instant> parsed = parseTimestamp(raw);
        if (parsed.isEmpty()) {
            violations.add(FieldViolation.of(INFORMED_TIME, ViolationCode.INVALID_FORMAT,
                    "informed_time must be valid datetime", raw));
            return null;
        }
        Instant informed = parsed.get();
        if (!leave || date == null) {
            return informed;
        }

        Instant leaveStart = date.atStartOfDay(zone).toInstant();
        if (status == AttendanceStatus.PLANNED_LEAVE && !informed.isBefore(leaveStart)) {
            violations.add(FieldViolation.of(INFORMED_TIME, ViolationCode.INFORMED_AFTER_LEAVE,
                    "informed_time must be before the leave date for planned leave", raw));
        } else if (status == AttendanceStatus.UNPLANNED_LEAVE
                && Duration.between(informed, leaveStart).abs().compareTo(Duration.ofHours(UNPLANNED_NOTICE_WINDOW_HOURS)) > 0) {
            violations.add(FieldViolation.of(INFORMED_TIME, ViolationCode.INFORMED_OUTSIDE_WINDOW,
                    "informed_time must be within 24 hours of date for unplanned leave", raw));
        }
        return informed;
    }

    /**
     * Accepts offset timestamps ({@code 2024-03-04T08:30:00Z}), local date-times separated
     * by {@code T} or a space, and plain dates. Local values are read in the configured zone.
     */
    Optional<Instant> parseTimestamp(String raw) {
        String value = raw.trim();
        return tryParse(value, v -> OffsetDateTime.parse(v).toInstant())
                .or(() -> tryParse(value, v -> LocalDateTime.parse(v.replace(' ', 'T')).atZone(zone).toInstant()))
                .or(() -> tryParse(value, v -> LocalDate.parse(v).atStartOfDay(zone).toInstant()));
    }

    private static Optional<Instant> tryParse(String value, Function<String, Instant> parser) {
        try {
            return Optional.of(parser.apply(value));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
