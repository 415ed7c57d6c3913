package it.floro.sampling.domain;

import java.time.LocalDate;

/**
 * Record che rappresenta un campione d'olio normalizzato: una bottiglia prelevata
 * da un equipaggiamento in una data certa.
 *
 * Tutti i record di questo tipo hanno una data valida; le righe senza data
 * vengono scartate a monte dalla normalizzazione.
 */
public record SampleRecord(
        // ============ IDENTITÀ DELL'EQUIPAGGIAMENTO ============
        String unitId,                      // Identificatore dell'unità
        String assetId,                     // Identificatore dell'asset

        // ============ ATTRIBUTI ============
        String accountName,                 // Operazione / cliente
        String sampleBottleId,              // Bottiglia: usata per il conteggio distinto
        LocalDate date,                     // Data del campionamento (obbligatoria)
        String assetClass                   // Classe dell'asset (etichetta categorica)
) {

    /**
     * @return Chiave dell'equipaggiamento (unità, asset)
     */
    public EquipmentKey key() {
        return new EquipmentKey(unitId, assetId);
    }

    /**
     * @return Anno solare del campionamento
     */
    public int year() {
        return date.getYear();
    }
}
