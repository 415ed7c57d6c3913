package it.floro.sampling.domain;

import java.util.List;

/**
 * Record che rappresenta una riga grezza del file MobilServ, così come arriva
 * dal lettore di file e prima di qualsiasi pulizia.
 *
 * La data di campionamento resta non tipizzata: può essere una stringa, una data
 * strutturata (LocalDate, LocalDateTime, Date, Instant) oppure assente.
 * La conversione è compito di RecordNormalizer.
 */
public record RawSampleRow(
        String unitId,                      // Colonna "Unit ID"
        String assetId,                     // Colonna "Asset ID"
        String accountName,                 // Colonna "Account Name" (operazione)
        String sampleBottleId,              // Colonna "Sample Bottle ID"
        Object dateSampled,                 // Colonna "Date Sampled" (valore grezzo, può essere null)
        String assetClass                   // Colonna "Asset Class"
) {

    // ============ NOMI DELLE COLONNE OBBLIGATORIE ============
    public static final String COL_UNIT_ID = "Unit ID";
    public static final String COL_ASSET_ID = "Asset ID";
    public static final String COL_ACCOUNT_NAME = "Account Name";
    public static final String COL_SAMPLE_BOTTLE_ID = "Sample Bottle ID";
    public static final String COL_DATE_SAMPLED = "Date Sampled";
    public static final String COL_ASSET_CLASS = "Asset Class";

    /**
     * Colonne richieste nell'ordine del formato MobilServ.
     */
    public static final List<String> REQUIRED_COLUMNS = List.of(
            COL_UNIT_ID,
            COL_ASSET_ID,
            COL_ACCOUNT_NAME,
            COL_SAMPLE_BOTTLE_ID,
            COL_DATE_SAMPLED,
            COL_ASSET_CLASS
    );
}
