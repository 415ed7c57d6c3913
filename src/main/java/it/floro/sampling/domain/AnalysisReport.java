package it.floro.sampling.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/**
 * Risultato completo di un'esecuzione dell'analisi.
 *
 * Raggruppa il report per equipaggiamento, il calendario delle date future
 * e i contatori della normalizzazione, così che l'esito sia leggibile anche
 * quando il sottoinsieme selezionato non contiene righe utilizzabili.
 */
public record AnalysisReport(
        // ============ PARAMETRI DI ESECUZIONE ============
        LocalDate runDate,                  // Data di riferimento ("oggi")
        LocalDate horizon,                  // Ultima data generabile dalla proiezione
        List<Integer> years,                // Finestra di anni del conteggio
        FrequencyUnit unit,                 // Unità della frequenza raccomandata
        List<String> operations,            // Operazioni selezionate (vuoto = tutte)

        // ============ CONTATORI ============
        int rowsRead,                       // Righe in ingresso dopo il filtro per operazione
        int rowsDropped,                    // Righe scartate per data non valida
        int samplesUsed,                    // Campioni utilizzati

        // ============ RISULTATI ============
        List<ReportRow> rows,               // Una riga per equipaggiamento
        List<ProjectionRow> projections     // Una riga per (equipaggiamento, data futura)
) {

    public AnalysisReport {
        years = List.copyOf(years);
        operations = List.copyOf(operations);
        rows = List.copyOf(rows);
        projections = List.copyOf(projections);
    }

    @JsonProperty("equipmentCount")
    public int equipmentCount() {
        return rows.size();
    }
}
