package com.example.Attrition.scoring;

import com.example.Attrition.model.AttendanceRecord;
import com.example.Attrition.model.AttendanceStatistics;
import com.example.Attrition.model.AttendanceStatus;
import com.example.Attrition.model.Employee;
import com.example.Attrition.model.RiskAssessment;
import com.example.Attrition.model.RiskFactorScores;
import com.example.Attrition.model.RiskLevel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Attrition risk scoring over one employee's attendance window.
 * <p>
 * Four signals, each scored 0-100 where higher means more risk:
 * <ul>
 *     <li>absenteeism - share of days marked Absent (job embeddedness)</li>
 *     <li>leave pattern - share of leave that was unplanned (conservation of resources)</li>
 *     <li>consistency - spread of weekly absence rates (erratic behaviour)</li>
 *     <li>recent trend - last three weeks against the three before (effort-reward imbalance)</li>
 * </ul>
 * The composite is their weighted sum. Records must be ordered by date ascending.
 */
@Component
public class RiskScoringEngine {

    static final double ABSENTEEISM_WEIGHT = 0.35;
    static final double LEAVE_PATTERN_WEIGHT = 0.25;
    static final double CONSISTENCY_WEIGHT = 0.25;
    static final double RECENT_TREND_WEIGHT = 0.15;

    static final int WEEK_LENGTH = 5;
    static final int TREND_MIN_RECORDS = 20;
    static final int TREND_WINDOW = 15;

    public RiskAssessment score(Employee employee, List<AttendanceRecord> records) {
        if (records.isEmpty()) {
            return RiskAssessment.builder()
                    .employeeId(employee.getEmployeeId())
                    .name(employee.getName())
                    .email(employee.getEmail())
                    .department(employee.getDepartment())
                    .score(0)
                    .riskLevel(RiskLevel.INSUFFICIENT_DATA)
                    .recommendation(RiskLevel.INSUFFICIENT_DATA.getRecommendation())
                    .build();
        }

        double absenteeism = absenteeismScore(records);
        double leavePattern = leavePatternScore(records);
        double consistency = consistencyScore(records);
        double recentTrend = recentTrendScore(records);

        double composite = round1(compositeScore(absenteeism, leavePattern, consistency, recentTrend));
        RiskLevel level = RiskLevel.fromScore(composite);

        return RiskAssessment.builder()
                .employeeId(employee.getEmployeeId())
                .name(employee.getName())
                .email(employee.getEmail())
                .department(employee.getDepartment())
                .score(composite)
                .riskLevel(level)
                .factors(RiskFactorScores.builder()
                        .absenteeism(round1(absenteeism))
                        .leavePattern(round1(leavePattern))
                        .consistency(round1(consistency))
                        .recentTrend(round1(recentTrend))
                        .build())
                .statistics(statistics(records))
                .recommendation(level.getRecommendation())
                .build();
    }

    static double compositeScore(double absenteeism, double leavePattern, double consistency, double recentTrend) {
        return absenteeism * ABSENTEEISM_WEIGHT
                + leavePattern * LEAVE_PATTERN_WEIGHT
                + consistency * CONSISTENCY_WEIGHT
                + recentTrend * RECENT_TREND_WEIGHT;
    }

    static double absenteeismScore(List<AttendanceRecord> records) {
        double absentRate = absentRate(records);

        if (absentRate >= 0.20) return 100;
        if (absentRate >= 0.15) return 85;
        if (absentRate >= 0.10) return 65;
        if (absentRate >= 0.05) return 40;
        return absentRate * 800; // meets the 40 step at 5%
    }

    static double leavePatternScore(List<AttendanceRecord> records) {
        long totalLeaves = records.stream().filter(r -> r.getStatus().isLeave()).count();
        if (totalLeaves == 0) return 0;

        long unplanned = count(records, AttendanceStatus.UNPLANNED_LEAVE);
        double unplannedRatio = (double) unplanned / totalLeaves;

        if (unplannedRatio >= 0.80) return 90;
        if (unplannedRatio >= 0.60) return 70;
        if (unplannedRatio >= 0.40) return 50;
        if (unplannedRatio >= 0.20) return 30;
        return unplannedRatio * 100;
    }

    static double consistencyScore(List<AttendanceRecord> records) {
        List<Double> weeklyRates = new ArrayList<>();
        for (int start = 0; start < records.size(); start += WEEK_LENGTH) {
            List<AttendanceRecord> week = records.subList(start, Math.min(start + WEEK_LENGTH, records.size()));
            weeklyRates.add(absentRate(week));
        }

        if (weeklyRates.size() < 2) return 0;

        double mean = weeklyRates.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        double variance = weeklyRates.stream()
                .mapToDouble(rate -> Math.pow(rate - mean, 2))
                .sum() / weeklyRates.size();

        return Math.min(Math.sqrt(variance) * 200, 100);
    }

    static double recentTrendScore(List<AttendanceRecord> records) {
        int size = records.size();
        if (size < TREND_MIN_RECORDS) return 0;

        List<AttendanceRecord> recent = records.subList(size - TREND_WINDOW, size);
        List<AttendanceRecord> previous = records.subList(Math.max(0, size - 2 * TREND_WINDOW), size - TREND_WINDOW);

        double trend = absentRate(recent) - absentRate(previous);

        if (trend >= 0.15) return 100;
        if (trend >= 0.10) return 75;
        if (trend >= 0.05) return 50;
        if (trend > 0) return trend * 500;
        return 0; // flat or improving
    }

    static AttendanceStatistics statistics(List<AttendanceRecord> records) {
        int total = records.size();
        int present = (int) count(records, AttendanceStatus.PRESENT);
        int absent = (int) count(records, AttendanceStatus.ABSENT);

        return AttendanceStatistics.builder()
                .totalDays(total)
                .presentDays(present)
                .absentDays(absent)
                .plannedLeaveDays((int) count(records, AttendanceStatus.PLANNED_LEAVE))
                .unplannedLeaveDays((int) count(records, AttendanceStatus.UNPLANNED_LEAVE))
                .attendanceRate(percent(present, total))
                .absenteeismRate(percent(absent, total))
                .build();
    }

    private static double absentRate(List<AttendanceRecord> records) {
        return (double) count(records, AttendanceStatus.ABSENT) / records.size();
    }

    private static long count(List<AttendanceRecord> records, AttendanceStatus status) {
        return records.stream().filter(r -> r.getStatus() == status).count();
    }

    private static String percent(int part, int total) {
        return String.format(Locale.ROOT, "%.2f%%", part * 100.0 / total);
    }

    static double round1(double value) {
        return Math.round(value * 10) / 10.0;
    }
}
