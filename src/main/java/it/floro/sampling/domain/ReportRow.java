package it.floro.sampling.domain;

import java.util.SortedMap;

/**
 * Riga del report finale: conteggio annuale unito (left join) alla raccomandazione
 * dello stesso equipaggiamento.
 */
public record ReportRow(
        EquipmentKey key,
        String assetClass,
        String accountName,
        SortedMap<Integer, Integer> samplesByYear,
        Double medianIntervalDays,          // null se non definita
        Double recommendedFrequency,        // null se non definita
        String recommendation,              // Forma testuale della raccomandazione (null se assente)
        Double meanIntervalDays,
        Double zScore
) {

    /**
     * Unisce il conteggio con la raccomandazione; una raccomandazione assente
     * produce campi vuoti, non un errore.
     *
     * @param tally Riga del conteggio annuale
     * @param rec Raccomandazione dello stesso equipaggiamento (può essere null)
     * @return Riga del report
     */
    public static ReportRow join(TallyRow tally, RecommendationRow rec) {
        return new ReportRow(
                tally.key(),
                tally.assetClass(),
                tally.accountName(),
                tally.samplesByYear(),
                rec != null ? rec.medianIntervalDays() : null,
                rec != null ? rec.recommendedFrequency() : null,
                rec != null ? rec.recommendation() : null,
                rec != null ? rec.meanIntervalDays() : null,
                rec != null ? rec.zScore() : null
        );
    }
}
