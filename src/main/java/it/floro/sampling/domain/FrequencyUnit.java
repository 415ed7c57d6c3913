package it.floro.sampling.domain;

/**
 * Unità in cui viene espressa la frequenza raccomandata.
 *
 * Il divisore converte un numero di giorni nell'unità: settimane = giorni / 7,
 * mesi = giorni / 30.
 */
public enum FrequencyUnit {
    WEEKS(7, "Weeks"),
    MONTHS(30, "Months");

    private final int daysPerUnit;
    private final String label;

    FrequencyUnit(int daysPerUnit, String label) {
        this.daysPerUnit = daysPerUnit;
        this.label = label;
    }

    public int daysPerUnit() {
        return daysPerUnit;
    }

    public String label() {
        return label;
    }

    /**
     * Parsing tollerante dell'unità da stringa.
     * Accetta sia terminologia inglese che italiana e spagnola.
     *
     * Esempi validi: "weeks", "week", "settimane", "semanas", "months", "mesi", "meses"
     *
     * @param s Stringa dell'unità (case-insensitive)
     * @param fallback Unità da usare se s è null o vuota
     * @return Unità corrispondente
     * @throws IllegalArgumentException se la stringa non è riconosciuta
     */
    public static FrequencyUnit ofNullable(String s, FrequencyUnit fallback) {
        if (s == null || s.isBlank()) return fallback;
        return switch (s.trim().toLowerCase()) {
            case "weeks", "week", "weekly", "w", "settimane", "semanas" -> WEEKS;
            case "months", "month", "monthly", "m", "mesi", "meses" -> MONTHS;
            default -> throw new IllegalArgumentException("Unità di frequenza non valida: " + s);
        };
    }
}
