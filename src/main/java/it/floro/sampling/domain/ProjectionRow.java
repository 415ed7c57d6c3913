package it.floro.sampling.domain;

import java.time.LocalDate;

/**
 * Una data futura di campionamento suggerita per un equipaggiamento.
 * La proiezione è una sequenza piatta: una riga per (equipaggiamento, data).
 */
public record ProjectionRow(
        EquipmentKey key,
        String assetClass,
        String accountName,
        LocalDate date                      // Data futura (mai sabato/domenica con la policy di default)
) {}
