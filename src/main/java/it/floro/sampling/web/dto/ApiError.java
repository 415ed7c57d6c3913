package it.floro.sampling.web.dto;

import java.time.Instant;

/**
 * Corpo JSON delle risposte di errore delle API REST.
 */
public record ApiError(
        int status,                         // Codice HTTP
        String error,                       // Descrizione standard del codice
        String message,                     // Dettaglio leggibile
        String path,                        // URI della richiesta
        Instant timestamp                   // Istante dell'errore
) {}
