package com.example.depositaccrual.dto;

import lombok.Value;

import java.time.LocalDate;

/**
 * Date range, inclusive at both ends, for which interest of a position is requested.
 * A window with {@code to} before {@code from} is empty.
 */
@Value(staticConstructor = "of")
public class AccrualWindow {

    LocalDate from;
    LocalDate to;

    public boolean isEmpty() {
        return to.isBefore(from);
    }

    /**
     * Restrict this window to the given term
     */
    public AccrualWindow clipTo(LocalDate termStart, LocalDate termEnd) {
        LocalDate clippedFrom = from.isBefore(termStart) ? termStart : from;
        LocalDate clippedTo = to.isAfter(termEnd) ? termEnd : to;
        return AccrualWindow.of(clippedFrom, clippedTo);
    }
}
