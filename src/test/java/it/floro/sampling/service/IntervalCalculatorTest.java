package it.floro.sampling.service;

import it.floro.sampling.domain.EquipmentKey;
import it.floro.sampling.domain.SampleRecord;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IntervalCalculatorTest {

    private final IntervalCalculator calculator = new IntervalCalculator();

    private static SampleRecord sample(String unit, String asset, String bottle, String date) {
        return new SampleRecord(unit, asset, "Op", bottle, LocalDate.parse(date), "Engine");
    }

    @Test
    void testIntervalsAreComputedInChronologicalOrder() {
        Map<EquipmentKey, List<Long>> intervals = calculator.intervals(List.of(
                sample("U1", "A1", "B3", "2024-07-01"),
                sample("U1", "A1", "B1", "2024-01-01"),
                sample("U1", "A1", "B2", "2024-04-01")
        ));

        assertEquals(List.of(91L, 91L), intervals.get(new EquipmentKey("U1", "A1")));
    }

    @Test
    void testSingleSampleHasNoInterval() {
        Map<EquipmentKey, List<Long>> intervals = calculator.intervals(List.of(
                sample("U9", "A9", "B1", "2024-05-05")
        ));

        assertTrue(intervals.get(new EquipmentKey("U9", "A9")).isEmpty());
    }

    @Test
    void testSameDaySamplesGiveZeroInterval() {
        Map<EquipmentKey, List<Long>> intervals = calculator.intervals(List.of(
                sample("U1", "A1", "B1", "2024-05-05"),
                sample("U1", "A1", "B2", "2024-05-05")
        ));

        assertEquals(List.of(0L), intervals.get(new EquipmentKey("U1", "A1")));
    }

    @Test
    void testIntervalCountIsSampleCountMinusOneAndNeverNegative() {
        List<SampleRecord> samples = List.of(
                sample("U1", "A1", "B1", "2023-12-30"),
                sample("U1", "A1", "B2", "2024-01-02"),
                sample("U1", "A1", "B3", "2023-06-01"),
                sample("U1", "A1", "B4", "2024-02-29"),
                sample("U2", "A1", "B5", "2022-01-01"),
                sample("U2", "A1", "B6", "2025-01-01")
        );

        Map<EquipmentKey, List<Long>> intervals = calculator.intervals(samples);

        assertEquals(3, intervals.get(new EquipmentKey("U1", "A1")).size());
        assertEquals(1, intervals.get(new EquipmentKey("U2", "A1")).size());
        intervals.values().forEach(list -> list.forEach(d -> assertTrue(d >= 0)));
        assertEquals(List.of(212L, 3L, 58L), intervals.get(new EquipmentKey("U1", "A1")));
    }

    @Test
    void testKeysAreSorted() {
        Map<EquipmentKey, List<Long>> intervals = calculator.intervals(List.of(
                sample("U2", "A1", "B1", "2024-01-01"),
                sample("U1", "A2", "B2", "2024-01-01"),
                sample("U1", "A1", "B3", "2024-01-01")
        ));

        assertIterableEquals(List.of(
                new EquipmentKey("U1", "A1"),
                new EquipmentKey("U1", "A2"),
                new EquipmentKey("U2", "A1")
        ), intervals.keySet());
    }
}
