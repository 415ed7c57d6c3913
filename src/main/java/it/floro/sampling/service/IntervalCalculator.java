package it.floro.sampling.service;

import it.floro.sampling.domain.EquipmentKey;
import it.floro.sampling.domain.SampleRecord;
import org.springframework.stereotype.Component;

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Calcolo degli intervalli in giorni tra campioni consecutivi dello stesso equipaggiamento.
 *
 * Per ogni chiave i campioni vengono ordinati per data crescente (ordinamento stabile);
 * ogni campione dopo il primo produce un intervallo = data - data precedente.
 * Un equipaggiamento con un solo campione produce una lista vuota.
 */
@Component
public class IntervalCalculator {

    /**
     * @param samples Campioni normalizzati
     * @return Mappa ordinata chiave → intervalli in giorni (lista vuota se un solo campione)
     */
    public SortedMap<EquipmentKey, List<Long>> intervals(List<SampleRecord> samples) {
        SortedMap<EquipmentKey, List<Long>> out = new TreeMap<>();
        for (Map.Entry<EquipmentKey, List<SampleRecord>> e : groupSorted(samples).entrySet()) {
            out.put(e.getKey(), intervalsOf(e.getValue()));
        }
        return out;
    }

    /**
     * Raggruppa i campioni per equipaggiamento, ciascun gruppo ordinato per data crescente.
     *
     * @param samples Campioni normalizzati
     * @return Mappa ordinata chiave → campioni in ordine cronologico
     */
    public SortedMap<EquipmentKey, List<SampleRecord>> groupSorted(List<SampleRecord> samples) {
        SortedMap<EquipmentKey, List<SampleRecord>> grouped = new TreeMap<>();
        for (SampleRecord s : samples) {
            grouped.computeIfAbsent(s.key(), k -> new ArrayList<>()).add(s);
        }
        grouped.values().forEach(list -> list.sort(Comparator.comparing(SampleRecord::date)));
        return grouped;
    }

    /**
     * @param chronological Campioni di un equipaggiamento già ordinati per data
     * @return Intervalli in giorni, lunghezza = campioni - 1
     */
    static List<Long> intervalsOf(List<SampleRecord> chronological) {
        List<Long> intervals = new ArrayList<>(Math.max(0, chronological.size() - 1));
        for (int i = 1; i < chronological.size(); i++) {
            intervals.add(ChronoUnit.DAYS.between(
                    chronological.get(i - 1).date(),
                    chronological.get(i).date()));
        }
        return intervals;
    }
}
