package com.example.Attrition.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@AllArgsConstructor
public class AttendanceStatistics {
    int totalDays;
    int presentDays;
    int absentDays;
    int plannedLeaveDays;
    int unplannedLeaveDays;
    String attendanceRate;   // e.g. "92.06%"
    String absenteeismRate;
}
