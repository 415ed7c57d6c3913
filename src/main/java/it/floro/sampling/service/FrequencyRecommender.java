package it.floro.sampling.service;

import it.floro.sampling.domain.EquipmentKey;
import it.floro.sampling.domain.FrequencyUnit;
import it.floro.sampling.domain.RecommendationRow;
import it.floro.sampling.domain.SampleRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;

/**
 * Raccomandazione della frequenza di campionamento per equipaggiamento.
 *
 * Statistica: mediana degli intervalli in giorni, usata in tutto il sistema.
 * La media resta come colonna ausiliaria, insieme allo z-score della media
 * all'interno della stessa Asset Class (deviazione standard di popolazione, divisione per N).
 *
 * Frequenza = mediana / giorni per unità (7 settimane, 30 mesi), arrotondata a 1 decimale HALF_UP.
 * Con meno di due campioni la raccomandazione non è definita: i campi sono null, mai zero.
 */
@Component
public class FrequencyRecommender {

    private static final double ZERO_STD_TOLERANCE = 1e-9;

    private final IntervalCalculator intervalCalculator;

    public FrequencyRecommender(IntervalCalculator intervalCalculator) {
        this.intervalCalculator = intervalCalculator;
    }

    /**
     * Calcola la raccomandazione per ogni equipaggiamento presente nei campioni.
     *
     * Procedura:
     * 1. Raggruppa e ordina i campioni per equipaggiamento
     * 2. Calcola gli intervalli consecutivi
     * 3. Mediana → frequenza nell'unità richiesta; media → colonna ausiliaria
     * 4. Z-score delle medie per Asset Class
     *
     * @param samples Campioni normalizzati
     * @param unit Unità della frequenza (settimane o mesi)
     * @return Una riga per equipaggiamento, ordinate per chiave (vuota se nessun campione)
     */
    public List<RecommendationRow> recommend(List<SampleRecord> samples, FrequencyUnit unit) {
        Objects.requireNonNull(unit, "unit");
        SortedMap<EquipmentKey, List<SampleRecord>> grouped = intervalCalculator.groupSorted(samples);

        List<RecommendationRow> rows = new ArrayList<>(grouped.size());
        for (Map.Entry<EquipmentKey, List<SampleRecord>> e : grouped.entrySet()) {
            List<SampleRecord> chronological = e.getValue();
            List<Long> intervals = IntervalCalculator.intervalsOf(chronological);
            SampleRecord last = chronological.get(chronological.size() - 1);

            Double median = median(intervals);
            Double mean = mean(intervals);
            Double frequency = toUnit(median, unit);

            rows.add(new RecommendationRow(
                    e.getKey(),
                    last.assetClass(),
                    last.accountName(),
                    chronological.size(),
                    last.date(),
                    median,
                    frequency,
                    unit,
                    format(frequency, unit),
                    mean,
                    null
            ));
        }
        return withAssetClassZScores(rows);
    }

    /**
     * Converte giorni nell'unità richiesta, arrotondando a 1 decimale.
     *
     * @param days Giorni (null ammesso)
     * @param unit Unità di destinazione
     * @return Valore nell'unità, o null se days è null
     */
    public static Double toUnit(Double days, FrequencyUnit unit) {
        if (days == null) return null;
        return BigDecimal.valueOf(days)
                .divide(BigDecimal.valueOf(unit.daysPerUnit()), 10, RoundingMode.HALF_UP)
                .setScale(1, RoundingMode.HALF_UP)
                .doubleValue();
    }

    /**
     * Forma testuale della raccomandazione, es. "3.0 Months"; "n/d" se non definita.
     */
    static String format(Double frequency, FrequencyUnit unit) {
        if (frequency == null) return "n/d";
        return String.format(Locale.ROOT, "%.1f %s", frequency, unit.label());
    }

    // ========================================================================
    // STATISTICHE
    // ========================================================================

    /**
     * Mediana; con numero pari di elementi è la media dei due centrali.
     *
     * @return Mediana, o null se la lista è vuota
     */
    static Double median(List<Long> values) {
        if (values.isEmpty()) return null;
        long[] sorted = values.stream().mapToLong(Long::longValue).sorted().toArray();
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return (double) sorted[mid];
        }
        return (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    /**
     * @return Media aritmetica, o null se la lista è vuota
     */
    static Double mean(List<Long> values) {
        if (values.isEmpty()) return null;
        return values.stream().mapToLong(Long::longValue).average().orElseThrow();
    }

    /**
     * Calcola lo z-score della media degli intervalli rispetto alle altre
     * apparecchiature della stessa Asset Class.
     *
     * z = (media - media della classe) / deviazione standard di popolazione della classe
     *
     * Lo z-score resta null se la media dell'equipaggiamento non è definita oppure
     * se la deviazione standard della classe è 0 (classe con un solo elemento o valori identici).
     */
    private static List<RecommendationRow> withAssetClassZScores(List<RecommendationRow> rows) {
        Map<String, List<Double>> meansByClass = new HashMap<>();
        for (RecommendationRow r : rows) {
            if (r.meanIntervalDays() == null) continue;
            meansByClass.computeIfAbsent(r.assetClass(), c -> new ArrayList<>()).add(r.meanIntervalDays());
        }

        Map<String, double[]> statsByClass = new HashMap<>();
        meansByClass.forEach((assetClass, means) -> {
            double mu = means.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
            double variance = means.stream()
                    .mapToDouble(m -> (m - mu) * (m - mu))
                    .sum() / means.size();
            statsByClass.put(assetClass, new double[]{mu, Math.sqrt(variance)});
        });

        List<RecommendationRow> out = new ArrayList<>(rows.size());
        for (RecommendationRow r : rows) {
            double[] stats = statsByClass.get(r.assetClass());
            if (r.meanIntervalDays() == null || stats == null || stats[1] < ZERO_STD_TOLERANCE) {
                out.add(r);
                continue;
            }
            out.add(r.withZScore((r.meanIntervalDays() - stats[0]) / stats[1]));
        }
        return out;
    }
}
