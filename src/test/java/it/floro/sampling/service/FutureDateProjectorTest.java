package it.floro.sampling.service;

import it.floro.sampling.config.SamplingProperties;
import it.floro.sampling.domain.EquipmentKey;
import it.floro.sampling.domain.FrequencyUnit;
import it.floro.sampling.domain.ProjectionRow;
import it.floro.sampling.domain.RecommendationRow;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FutureDateProjectorTest {

    private static final EquipmentKey KEY = new EquipmentKey("U1", "A1");

    private final FutureDateProjector projector = new FutureDateProjector(SamplingProperties.defaults());

    private static RecommendationRow rec(Double medianDays, LocalDate lastDate) {
        Double freq = FrequencyRecommender.toUnit(medianDays, FrequencyUnit.MONTHS);
        return new RecommendationRow(KEY, "Engine", "Op", medianDays == null ? 1 : 3, lastDate,
                medianDays, freq, FrequencyUnit.MONTHS, FrequencyRecommender.format(freq, FrequencyUnit.MONTHS),
                medianDays, null);
    }

    private static List<LocalDate> dates(List<ProjectionRow> rows) {
        return rows.stream().map(ProjectionRow::date).toList();
    }

    @Test
    void testHorizonIsEndOfNextYear() {
        assertEquals(LocalDate.of(2026, 12, 31), projector.horizonFor(LocalDate.of(2025, 6, 16)));
        assertEquals(LocalDate.of(2025, 12, 31),
                new FutureDateProjector(BusinessDayPolicy.weekends(), 0, 0).horizonFor(LocalDate.of(2025, 1, 1)));
    }

    @Test
    void testSundayRollsToMondayAndNextStepStartsFromRolledDate() {
        LocalDate last = LocalDate.of(2025, 6, 13);
        List<ProjectionRow> rows = projector.project(List.of(rec(30.0, last)), Map.of(KEY, last),
                LocalDate.of(2025, 6, 10));

        assertEquals(LocalDate.of(2025, 7, 14), rows.get(0).date());
        assertEquals(DayOfWeek.MONDAY, rows.get(0).date().getDayOfWeek());
        assertEquals(LocalDate.of(2025, 8, 13), rows.get(1).date());
    }

    @Test
    void testRunDateIsStartWhenLaterThanLastSample() {
        LocalDate last = LocalDate.of(2025, 6, 13);
        List<ProjectionRow> rows = projector.project(List.of(rec(30.0, last)), Map.of(KEY, last),
                LocalDate.of(2025, 6, 16));

        assertEquals(LocalDate.of(2025, 7, 16), rows.get(0).date());
    }

    @Test
    void testQuarterlyScheduleUntilHorizon() {
        LocalDate last = LocalDate.of(2024, 7, 1);
        List<ProjectionRow> rows = projector.project(List.of(rec(91.0, last)), Map.of(KEY, last),
                LocalDate.of(2025, 6, 16));

        assertEquals(List.of(
                LocalDate.of(2025, 9, 15),
                LocalDate.of(2025, 12, 15),
                LocalDate.of(2026, 3, 16),
                LocalDate.of(2026, 6, 15),
                LocalDate.of(2026, 9, 14),
                LocalDate.of(2026, 12, 14)
        ), dates(rows));
    }

    @Test
    void testDatesAreBusinessDaysWithinHorizonAndIncreasing() {
        LocalDate runDate = LocalDate.of(2025, 3, 1);
        LocalDate horizon = projector.horizonFor(runDate);
        for (int interval = 1; interval <= 45; interval++) {
            LocalDate last = runDate.minusDays(interval % 11);
            List<LocalDate> dates = dates(projector.project(List.of(rec((double) interval, last)),
                    Map.of(KEY, last), runDate));

            assertFalse(dates.isEmpty(), "intervallo " + interval);
            LocalDate previous = runDate;
            for (LocalDate d : dates) {
                assertTrue(d.isAfter(previous), "intervallo " + interval + ": " + d);
                assertFalse(d.isAfter(horizon));
                assertNotEquals(DayOfWeek.SATURDAY, d.getDayOfWeek());
                assertNotEquals(DayOfWeek.SUNDAY, d.getDayOfWeek());
                previous = d;
            }
        }
    }

    @Test
    void testSubDayIntervalIsSkipped() {
        LocalDate last = LocalDate.of(2025, 6, 13);
        assertTrue(projector.project(List.of(rec(0.0, last)), Map.of(KEY, last), last).isEmpty());
        assertTrue(projector.project(List.of(rec(0.4, last)), Map.of(KEY, last), last).isEmpty());
    }

    @Test
    void testHalfDayMedianRoundsToOneDay() {
        LocalDate friday = LocalDate.of(2025, 6, 13);
        List<LocalDate> dates = dates(projector.project(List.of(rec(0.5, friday)), Map.of(KEY, friday), friday));

        assertEquals(LocalDate.of(2025, 6, 16), dates.get(0));
        assertEquals(LocalDate.of(2025, 6, 17), dates.get(1));
    }

    @Test
    void testNoRecommendationIsExcludedUnlessFallbackConfigured() {
        LocalDate last = LocalDate.of(2025, 6, 13);
        RecommendationRow none = rec(null, last);

        assertTrue(projector.project(List.of(none), Map.of(KEY, last), last).isEmpty());

        FutureDateProjector withFallback = new FutureDateProjector(BusinessDayPolicy.weekends(), 0, 14);
        List<LocalDate> dates = dates(withFallback.project(List.of(none), Map.of(KEY, last), last));
        assertEquals(LocalDate.of(2025, 6, 27), dates.get(0));
        assertEquals(LocalDate.of(2025, 12, 26), dates.get(dates.size() - 1));
    }

    @Test
    void testCustomNonBusinessDays() {
        FutureDateProjector fridaysOff = new FutureDateProjector(
                new BusinessDayPolicy(EnumSet.of(DayOfWeek.FRIDAY)), 0, 0);
        LocalDate thursday = LocalDate.of(2025, 6, 12);

        List<LocalDate> dates = dates(fridaysOff.project(List.of(rec(1.0, thursday)), Map.of(KEY, thursday), thursday));

        assertEquals(LocalDate.of(2025, 6, 14), dates.get(0));
        assertTrue(dates.stream().noneMatch(d -> d.getDayOfWeek() == DayOfWeek.FRIDAY));
    }
}
