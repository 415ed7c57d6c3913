package it.floro.sampling.domain;

import java.util.Comparator;
import java.util.Objects;

/**
 * Chiave che identifica un equipaggiamento fisico nel tempo: coppia (Unit ID, Asset ID).
 *
 * L'ordinamento naturale (unità, poi asset, null in coda) rende deterministico
 * l'ordine delle righe nei report.
 */
public record EquipmentKey(String unitId, String assetId) implements Comparable<EquipmentKey> {

    private static final Comparator<String> NULLS_LAST =
            Comparator.nullsLast(Comparator.naturalOrder());

    private static final Comparator<EquipmentKey> ORDER = Comparator
            .comparing(EquipmentKey::unitId, NULLS_LAST)
            .thenComparing(EquipmentKey::assetId, NULLS_LAST);

    @Override
    public int compareTo(EquipmentKey other) {
        return ORDER.compare(this, other);
    }

    /**
     * @return Etichetta leggibile "unità/asset"
     */
    public String label() {
        return Objects.toString(unitId, "") + "/" + Objects.toString(assetId, "");
    }
}
