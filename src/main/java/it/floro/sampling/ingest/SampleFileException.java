package it.floro.sampling.ingest;

/**
 * Errore di lettura del file caricato: estensione non supportata, file vuoto,
 * colonne obbligatorie mancanti o contenuto illeggibile.
 *
 * È un errore del client: viene tradotto in HTTP 400 e mostrato all'utente.
 */
public class SampleFileException extends RuntimeException {

    public SampleFileException(String message) {
        super(message);
    }

    public SampleFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
