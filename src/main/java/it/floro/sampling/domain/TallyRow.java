package it.floro.sampling.domain;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Record che rappresenta il conteggio annuale dei campioni distinti
 * (per Sample Bottle ID) di un equipaggiamento.
 *
 * La mappa contiene sempre tutti gli anni della finestra di analisi,
 * con valore 0 per gli anni senza campioni.
 */
public record TallyRow(
        EquipmentKey key,                   // (Unit ID, Asset ID)
        String assetClass,                  // Classe dell'asset (dal campione più recente)
        String accountName,                 // Operazione (dal campione più recente)
        SortedMap<Integer, Integer> samplesByYear  // Anno → bottiglie distinte
) {

    public TallyRow {
        samplesByYear = Collections.unmodifiableSortedMap(new TreeMap<>(samplesByYear));
    }

    public static TallyRow zeroFilled(EquipmentKey key, String assetClass, String accountName,
                                      Iterable<Integer> years, Map<Integer, Integer> counts) {
        SortedMap<Integer, Integer> filled = new TreeMap<>();
        for (Integer y : years) {
            filled.put(y, counts.getOrDefault(y, 0));
        }
        return new TallyRow(key, assetClass, accountName, filled);
    }
}
