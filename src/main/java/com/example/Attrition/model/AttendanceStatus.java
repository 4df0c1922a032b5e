package com.example.Attrition.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum AttendanceStatus {
    PRESENT("Present"),
    PLANNED_LEAVE("Planned Leave"),
    UNPLANNED_LEAVE("Unplanned Leave"),
    ABSENT("Absent");

    private final String label;

    AttendanceStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isLeave() {
        return this == PLANNED_LEAVE || this == UNPLANNED_LEAVE;
    }

    // Exact match on the spreadsheet label, e.g. "Planned Leave"
    public static Optional<AttendanceStatus> fromLabel(String label) {
        return Arrays.stream(values())
                .filter(s -> s.label.equals(label))
                .findFirst();
    }
}
