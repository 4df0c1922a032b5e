package com.example.Attrition.scoring;

import com.example.Attrition.model.AttendanceRecord;
import com.example.Attrition.model.AttendanceStatus;
import com.example.Attrition.model.RiskAssessment;
import com.example.Attrition.model.RiskLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static com.example.Attrition.model.AttendanceStatus.*;
import static com.example.Attrition.support.AttendanceFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RiskScoringEngine")
class RiskScoringEngineTest {

    private static final double EPS = 1e-9;

    private final RiskScoringEngine engine = new RiskScoringEngine();

    private static List<AttendanceStatus> pattern(Object... countsAndStatuses) {
        List<AttendanceStatus> statuses = new ArrayList<>();
        for (int i = 0; i < countsAndStatuses.length; i += 2) {
            statuses.addAll(statuses((Integer) countsAndStatuses[i], (AttendanceStatus) countsAndStatuses[i + 1]));
        }
        return statuses;
    }

    private static List<AttendanceRecord> recs(Object... countsAndStatuses) {
        return records("E1", pattern(countsAndStatuses));
    }

    @Nested
    @DisplayName("absenteeism")
    class Absenteeism {

        @Test
        void noAbsenceScoresZero() {
            assertEquals(0, RiskScoringEngine.absenteeismScore(recs(40, PRESENT)), EPS);
        }

        @Test
        void rampAndStepAgreeAtFivePercent() {
            // 3 of 60 = exactly 5%
            assertEquals(40, RiskScoringEngine.absenteeismScore(recs(57, PRESENT, 3, ABSENT)), EPS);
            assertEquals(40, 0.05 * 800, EPS);
        }

        @Test
        void linearBelowFivePercent() {
            // 1 of 21
            assertEquals(800.0 / 21, RiskScoringEngine.absenteeismScore(recs(20, PRESENT, 1, ABSENT)), EPS);
        }

        @ParameterizedTest(name = "{0} absent of 20 -> {1}")
        @CsvSource({"1, 40", "2, 65", "3, 85", "4, 100", "10, 100"})
        void steps(int absent, double expected) {
            assertEquals(expected, RiskScoringEngine.absenteeismScore(recs(20 - absent, PRESENT, absent, ABSENT)), EPS);
        }
    }

    @Nested
    @DisplayName("leave pattern")
    class LeavePattern {

        @Test
        void noLeaveScoresZero() {
            assertEquals(0, RiskScoringEngine.leavePatternScore(recs(10, PRESENT, 2, ABSENT)), EPS);
        }

        @Test
        void mostlyUnplannedIsHighest() {
            assertEquals(90, RiskScoringEngine.leavePatternScore(recs(4, UNPLANNED_LEAVE, 1, PLANNED_LEAVE)), EPS);
        }

        @Test
        void quarterUnplannedHitsTwentyPercentBand() {
            assertEquals(30, RiskScoringEngine.leavePatternScore(recs(1, UNPLANNED_LEAVE, 3, PLANNED_LEAVE)), EPS);
        }

        @Test
        void lowRatioIsLinear() {
            assertEquals(10, RiskScoringEngine.leavePatternScore(recs(1, UNPLANNED_LEAVE, 9, PLANNED_LEAVE)), EPS);
        }

        @Test
        void absencesDoNotCountAsLeave() {
            assertEquals(0, RiskScoringEngine.leavePatternScore(recs(5, ABSENT, 3, PLANNED_LEAVE)), EPS);
        }
    }

    @Nested
    @DisplayName("consistency")
    class Consistency {

        @Test
        void singleWeekScoresZero() {
            assertEquals(0, RiskScoringEngine.consistencyScore(recs(4, PRESENT, 1, ABSENT)), EPS);
        }

        @Test
        void identicalWeeksScoreZero() {
            List<AttendanceStatus> weeks = new ArrayList<>();
            for (int w = 0; w < 6; w++) weeks.addAll(pattern(4, PRESENT, 1, ABSENT));
            assertEquals(0, RiskScoringEngine.consistencyScore(records("E1", weeks)), EPS);
        }

        @Test
        void standardDeviationIsScaled() {
            // weekly rates 0.2 and 0.0 -> population std dev 0.1
            assertEquals(20, RiskScoringEngine.consistencyScore(recs(1, ABSENT, 9, PRESENT)), 1e-6);
        }

        @Test
        void cappedAtHundred() {
            assertEquals(100, RiskScoringEngine.consistencyScore(recs(5, ABSENT, 5, PRESENT)), EPS);
        }

        @Test
        void trailingPartialWeekIsItsOwnChunk() {
            // weeks: 0.0, then a 2-day chunk at 0.5 -> std dev 0.25
            assertEquals(50, RiskScoringEngine.consistencyScore(recs(5, PRESENT, 1, ABSENT, 1, PRESENT)), 1e-6);
        }
    }

    @Nested
    @DisplayName("recent trend")
    class RecentTrend {

        @Test
        void needsTwentyRecords() {
            assertEquals(0, RiskScoringEngine.recentTrendScore(recs(4, PRESENT, 15, ABSENT)), EPS);
        }

        @Test
        void sharpDeteriorationIsMaximal() {
            assertEquals(100, RiskScoringEngine.recentTrendScore(recs(15, PRESENT, 12, PRESENT, 3, ABSENT)), EPS);
        }

        @Test
        void oneExtraAbsenceInFifteenIsFifty() {
            assertEquals(50, RiskScoringEngine.recentTrendScore(recs(15, PRESENT, 14, PRESENT, 1, ABSENT)), EPS);
        }

        @Test
        void smallIncreaseIsLinear() {
            // 25 records: previous window is the first 10 (1 absent), recent 15 (2 absent)
            List<AttendanceRecord> records = recs(1, ABSENT, 9, PRESENT, 13, PRESENT, 2, ABSENT);
            double trend = 2.0 / 15 - 1.0 / 10;
            assertEquals(trend * 500, RiskScoringEngine.recentTrendScore(records), 1e-6);
        }

        @Test
        void improvementContributesNothing() {
            assertEquals(0, RiskScoringEngine.recentTrendScore(recs(5, ABSENT, 10, PRESENT, 15, PRESENT)), EPS);
        }

        @Test
        void flatTrendContributesNothing() {
            assertEquals(0, RiskScoringEngine.recentTrendScore(recs(30, ABSENT)), EPS);
        }
    }

    @Nested
    @DisplayName("composite and level")
    class Composite {

        @Test
        void weightsSumToOne() {
            assertEquals(1.0, RiskScoringEngine.ABSENTEEISM_WEIGHT + RiskScoringEngine.LEAVE_PATTERN_WEIGHT
                    + RiskScoringEngine.CONSISTENCY_WEIGHT + RiskScoringEngine.RECENT_TREND_WEIGHT, EPS);
        }

        @ParameterizedTest
        @CsvSource({"0,0,0,0", "100,90,100,100", "100,0,0,0", "12.5,30,83.2,50", "100,100,100,100"})
        void compositeStaysWithinBounds(double a, double l, double c, double t) {
            double composite = RiskScoringEngine.compositeScore(a, l, c, t);
            assertTrue(composite >= 0 && composite <= 100, "composite " + composite);
            assertTrue(composite <= Math.max(Math.max(a, l), Math.max(c, t)) + EPS);
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({"0, LOW", "39.9, LOW", "40, MODERATE", "69.9, MODERATE", "70, HIGH", "100, HIGH"})
        void levelBandsAreInclusiveAtLowerBound(double score, RiskLevel expected) {
            assertEquals(expected, RiskLevel.fromScore(score));
        }

        @Test
        void levelNeverDecreasesAsScoreRises() {
            RiskLevel previous = RiskLevel.fromScore(0);
            for (int tenths = 1; tenths <= 1000; tenths++) {
                RiskLevel current = RiskLevel.fromScore(tenths / 10.0);
                assertTrue(rank(current) >= rank(previous), "level dropped at " + tenths / 10.0);
                previous = current;
            }
        }

        private int rank(RiskLevel level) {
            return switch (level) {
                case LOW -> 0;
                case MODERATE -> 1;
                case HIGH -> 2;
                case INSUFFICIENT_DATA -> -1;
            };
        }
    }

    @Nested
    @DisplayName("score")
    class Score {

        @Test
        void noRecordsIsInsufficientData() {
            RiskAssessment assessment = engine.score(employee("E1"), List.of());

            assertEquals(RiskLevel.INSUFFICIENT_DATA, assessment.getRiskLevel());
            assertEquals(0, assessment.getScore(), EPS);
            assertNull(assessment.getFactors());
            assertNull(assessment.getStatistics());
            assertTrue(assessment.getRecommendation().contains("3 months"));
            assertEquals("E1", assessment.getEmployeeId());
        }

        @Test
        void fullAttendanceIsLowRisk() {
            RiskAssessment assessment = engine.score(employee("E1"), recs(63, PRESENT));

            assertEquals(0, assessment.getFactors().getAbsenteeism(), EPS);
            assertEquals(0, assessment.getFactors().getLeavePattern(), EPS);
            assertEquals(0, assessment.getFactors().getConsistency(), EPS);
            assertEquals(0, assessment.getFactors().getRecentTrend(), EPS);
            assertEquals(0, assessment.getScore(), EPS);
            assertEquals(RiskLevel.LOW, assessment.getRiskLevel());
            assertEquals(RiskLevel.LOW.getRecommendation(), assessment.getRecommendation());
            assertEquals("100.00%", assessment.getStatistics().getAttendanceRate());
            assertEquals("0.00%", assessment.getStatistics().getAbsenteeismRate());
        }

        @Test
        void lateRunOfAbsencesIsHighRisk() {
            // 14 of 63 absent (22%), all at the end
            RiskAssessment assessment = engine.score(employee("E1"), recs(49, PRESENT, 14, ABSENT));

            assertEquals(100, assessment.getFactors().getAbsenteeism(), EPS);
            assertEquals(0, assessment.getFactors().getLeavePattern(), EPS);
            assertEquals(83.2, assessment.getFactors().getConsistency(), EPS);
            assertEquals(100, assessment.getFactors().getRecentTrend(), EPS);
            assertEquals(70.8, assessment.getScore(), EPS);
            assertEquals(RiskLevel.HIGH, assessment.getRiskLevel());
            assertTrue(assessment.getRecommendation().startsWith("URGENT"));
        }

        @Test
        void levelAgreesWithReportedScore() {
            RiskAssessment assessment = engine.score(employee("E1"), recs(50, PRESENT, 13, ABSENT));
            assertEquals(RiskLevel.fromScore(assessment.getScore()), assessment.getRiskLevel());
            assertEquals(100, assessment.getFactors().getAbsenteeism(), EPS);
        }

        @Test
        void statisticsCountEachStatus() {
            RiskAssessment assessment = engine.score(employee("E1"),
                    recs(2, PRESENT, 1, ABSENT, 1, PLANNED_LEAVE, 2, UNPLANNED_LEAVE, 2, PRESENT));

            var stats = assessment.getStatistics();
            assertEquals(8, stats.getTotalDays());
            assertEquals(4, stats.getPresentDays());
            assertEquals(1, stats.getAbsentDays());
            assertEquals(1, stats.getPlannedLeaveDays());
            assertEquals(2, stats.getUnplannedLeaveDays());
            assertEquals("50.00%", stats.getAttendanceRate());
            assertEquals("12.50%", stats.getAbsenteeismRate());
        }

        @Test
        void scoreHasOneDecimal() {
            RiskAssessment assessment = engine.score(employee("E1"), recs(20, PRESENT, 1, ABSENT));
            assertEquals(assessment.getScore(), Math.round(assessment.getScore() * 10) / 10.0, EPS);
        }
    }
}
