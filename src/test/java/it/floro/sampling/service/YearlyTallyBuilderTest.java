package it.floro.sampling.service;

import it.floro.sampling.config.SamplingProperties;
import it.floro.sampling.domain.EquipmentKey;
import it.floro.sampling.domain.FrequencyUnit;
import it.floro.sampling.domain.SampleRecord;
import it.floro.sampling.domain.TallyRow;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class YearlyTallyBuilderTest {

    private static final LocalDate RUN_DATE = LocalDate.of(2025, 6, 16);

    private final YearlyTallyBuilder builder = new YearlyTallyBuilder(SamplingProperties.defaults());

    private static SampleRecord sample(String unit, String bottle, String date, String assetClass, String account) {
        return new SampleRecord(unit, "A1", account, bottle, LocalDate.parse(date), assetClass);
    }

    private static int total(TallyRow row) {
        return row.samplesByYear().values().stream().mapToInt(Integer::intValue).sum();
    }

    @Test
    void testYearWindowRunsFromFirstYearToRunYear() {
        assertEquals(List.of(2021, 2022, 2023, 2024, 2025), builder.yearsFor(RUN_DATE));
    }

    @Test
    void testYearWindowIsEmptyWhenFirstYearIsLater() {
        SamplingProperties props = new SamplingProperties(2030, FrequencyUnit.MONTHS, ZoneId.of("UTC"),
                new SamplingProperties.Projection(1, 0, EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY)),
                new SamplingProperties.Export("x"));

        assertTrue(new YearlyTallyBuilder(props).yearsFor(RUN_DATE).isEmpty());
    }

    @Test
    void testDistinctBottlesAreCountedAndMissingYearsAreZero() {
        List<Integer> years = builder.yearsFor(RUN_DATE);
        List<TallyRow> rows = builder.tally(List.of(
                sample("U1", "B1", "2024-01-01", "Engine", "Op"),
                sample("U1", "B2", "2024-04-01", "Engine", "Op"),
                sample("U1", "B2", "2024-07-01", "Engine", "Op"),
                sample("U1", null, "2024-09-01", "Engine", "Op"),
                sample("U1", "B9", "2022-02-02", "Engine", "Op")
        ), years);

        assertEquals(1, rows.size());
        TallyRow row = rows.get(0);
        assertEquals(new EquipmentKey("U1", "A1"), row.key());
        assertEquals(List.of(2021, 2022, 2023, 2024, 2025), List.copyOf(row.samplesByYear().keySet()));
        assertEquals(0, row.samplesByYear().get(2021));
        assertEquals(1, row.samplesByYear().get(2022));
        assertEquals(0, row.samplesByYear().get(2023));
        assertEquals(2, row.samplesByYear().get(2024));
        assertEquals(0, row.samplesByYear().get(2025));
        assertEquals(3, total(row));
    }

    @Test
    void testOutOfWindowEquipmentStillGetsZeroRow() {
        List<TallyRow> rows = builder.tally(List.of(
                sample("U7", "B1", "2019-05-05", "Gearbox", "Op"),
                sample("U7", "B2", "2026-01-10", "Gearbox", "Op")
        ), builder.yearsFor(RUN_DATE));

        assertEquals(1, rows.size());
        assertEquals(0, total(rows.get(0)));
        assertEquals(5, rows.get(0).samplesByYear().size());
    }

    @Test
    void testAttributesComeFromLatestSample() {
        List<TallyRow> rows = builder.tally(List.of(
                sample("U1", "B1", "2023-01-01", "Engine", "Old Op"),
                sample("U1", "B2", "2025-03-01", "Engine V2", "New Op"),
                sample("U1", "B3", "2024-01-01", "Engine", "Old Op")
        ), builder.yearsFor(RUN_DATE));

        assertEquals(1, rows.size());
        assertEquals("Engine V2", rows.get(0).assetClass());
        assertEquals("New Op", rows.get(0).accountName());
    }

    @Test
    void testRowsAreOrderedByKeyAndCountsNeverExceedDistinctBottles() {
        List<SampleRecord> samples = List.of(
                sample("U3", "B1", "2024-01-01", "Engine", "Op"),
                sample("U1", "B1", "2024-01-01", "Engine", "Op"),
                sample("U2", "B1", "2024-01-01", "Engine", "Op"),
                sample("U2", "B1", "2024-02-01", "Engine", "Op")
        );

        List<TallyRow> rows = builder.tally(samples, builder.yearsFor(RUN_DATE));

        assertEquals(List.of("U1", "U2", "U3"), rows.stream().map(r -> r.key().unitId()).toList());
        assertEquals(1, total(rows.get(1)));
    }
}
