package it.floro.sampling.service;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Set;

/**
 * Regola dei giorni non lavorativi usata dalla proiezione: una data che cade
 * in un giorno non lavorativo slitta in avanti al primo giorno lavorativo.
 *
 * Con la policy di default (sabato e domenica) sabato e domenica diventano il lunedì successivo.
 */
public final class BusinessDayPolicy {

    private final EnumSet<DayOfWeek> nonBusinessDays;

    public BusinessDayPolicy(Set<DayOfWeek> nonBusinessDays) {
        this.nonBusinessDays = nonBusinessDays.isEmpty()
                ? EnumSet.noneOf(DayOfWeek.class)
                : EnumSet.copyOf(nonBusinessDays);
        if (this.nonBusinessDays.size() == DayOfWeek.values().length) {
            throw new IllegalArgumentException("Almeno un giorno della settimana deve essere lavorativo");
        }
    }

    public static BusinessDayPolicy weekends() {
        return new BusinessDayPolicy(EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY));
    }

    public boolean isBusinessDay(LocalDate date) {
        return !nonBusinessDays.contains(date.getDayOfWeek());
    }

    /**
     * @param date Data candidata
     * @return La data stessa se lavorativa, altrimenti il primo giorno lavorativo successivo
     */
    public LocalDate rollForward(LocalDate date) {
        LocalDate d = date;
        while (!isBusinessDay(d)) {
            d = d.plusDays(1);
        }
        return d;
    }
}
