package it.floro.sampling.service;

import it.floro.sampling.config.SamplingProperties;
import it.floro.sampling.domain.EquipmentKey;
import it.floro.sampling.domain.SampleRecord;
import it.floro.sampling.domain.TallyRow;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Costruzione della tabella dei campioni per anno e per equipaggiamento.
 *
 * Per ogni equipaggiamento conta le bottiglie distinte (Sample Bottle ID) di ogni anno
 * della finestra di analisi. La finestra va dal primo anno configurato all'anno della
 * data di esecuzione e non è una costante: cresce di un anno ogni anno.
 *
 * Invariante: ogni equipaggiamento presente in ingresso produce esattamente una riga,
 * con tutti gli anni della finestra (0 dove non ci sono campioni).
 */
@Component
public class YearlyTallyBuilder {

    private final int firstYear;

    public YearlyTallyBuilder(SamplingProperties properties) {
        this.firstYear = properties.firstYear();
    }

    /**
     * Calcola la finestra di anni [primo anno configurato, anno di runDate].
     *
     * @param runDate Data di esecuzione
     * @return Anni in ordine crescente (vuota se il primo anno è successivo all'anno di esecuzione)
     */
    public List<Integer> yearsFor(LocalDate runDate) {
        return IntStream.rangeClosed(firstYear, runDate.getYear())
                .boxed()
                .collect(Collectors.toList());
    }

    /**
     * Conta le bottiglie distinte per equipaggiamento e anno.
     *
     * Algoritmo:
     * 1. Raggruppa i campioni per chiave (Unit ID, Asset ID)
     * 2. Per ogni anno della finestra, raccoglie gli ID bottiglia non vuoti in un Set
     * 3. Riempie con 0 gli anni senza campioni
     * 4. Asset Class e Account Name vengono dal campione più recente dell'equipaggiamento
     *
     * I campioni fuori finestra non vengono contati, ma il loro equipaggiamento
     * compare comunque con tutti zeri.
     *
     * @param samples Campioni normalizzati
     * @param years Finestra di anni
     * @return Una riga per equipaggiamento, ordinate per chiave
     */
    public List<TallyRow> tally(List<SampleRecord> samples, List<Integer> years) {
        Set<Integer> window = new HashSet<>(years);

        SortedMap<EquipmentKey, List<SampleRecord>> byKey = new TreeMap<>();
        for (SampleRecord s : samples) {
            byKey.computeIfAbsent(s.key(), k -> new ArrayList<>()).add(s);
        }

        List<TallyRow> rows = new ArrayList<>(byKey.size());
        for (Map.Entry<EquipmentKey, List<SampleRecord>> e : byKey.entrySet()) {
            List<SampleRecord> group = e.getValue();

            // Bottiglie distinte per anno, solo dentro la finestra
            Map<Integer, Set<String>> bottlesByYear = new HashMap<>();
            for (SampleRecord s : group) {
                if (s.sampleBottleId() == null || !window.contains(s.year())) continue;
                bottlesByYear.computeIfAbsent(s.year(), y -> new HashSet<>()).add(s.sampleBottleId());
            }
            Map<Integer, Integer> counts = new TreeMap<>();
            bottlesByYear.forEach((y, ids) -> counts.put(y, ids.size()));

            SampleRecord latest = group.stream()
                    .max(Comparator.comparing(SampleRecord::date))
                    .orElseThrow();

            rows.add(TallyRow.zeroFilled(e.getKey(), latest.assetClass(), latest.accountName(), years, counts));
        }
        return rows;
    }
}
