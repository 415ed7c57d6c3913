package it.floro.sampling.domain;

import java.time.LocalDate;

/**
 * Record che rappresenta la frequenza di campionamento raccomandata per un equipaggiamento.
 *
 * I campi derivati dagli intervalli sono null quando l'equipaggiamento ha meno di due
 * campioni: null è il marcatore esplicito di "nessuna raccomandazione" e non va mai
 * convertito in zero.
 */
public record RecommendationRow(
        // ============ IDENTITÀ ============
        EquipmentKey key,                   // (Unit ID, Asset ID)
        String assetClass,                  // Classe dell'asset
        String accountName,                 // Operazione

        // ============ STORICO ============
        int sampleCount,                    // Campioni con data valida
        LocalDate lastSampleDate,           // Ultima data di campionamento nota

        // ============ RACCOMANDAZIONE ============
        Double medianIntervalDays,          // Mediana degli intervalli in giorni (null = non definita)
        Double recommendedFrequency,        // Mediana / divisore dell'unità, 1 decimale (null = non definita)
        FrequencyUnit unit,                 // Unità della frequenza raccomandata
        String recommendation,              // Forma testuale, es. "3.0 Months" ("n/d" se non definita)

        // ============ ANALITICA AUSILIARIA ============
        Double meanIntervalDays,            // Media degli intervalli in giorni
        Double zScore                       // Z-score della media nella propria Asset Class
) {

    public boolean hasRecommendation() {
        return medianIntervalDays != null;
    }

    public RecommendationRow withZScore(Double z) {
        return new RecommendationRow(key, assetClass, accountName, sampleCount, lastSampleDate,
                medianIntervalDays, recommendedFrequency, unit, recommendation, meanIntervalDays, z);
    }
}
