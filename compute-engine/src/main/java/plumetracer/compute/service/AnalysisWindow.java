package plumetracer.compute.service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Ventana temporal de análisis: desde las 00:00 del día indicado hasta {@code hours} horas después.
 * Año, mes o día ausentes se toman de "ayer" según el reloj inyectado.
 */
public record AnalysisWindow(LocalDateTime start, LocalDateTime end) {

    public AnalysisWindow {
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("La ventana termina (" + end + ") antes de empezar (" + start + ")");
        }
    }

    public static AnalysisWindow resolve(Integer year, Integer month, Integer day, int hours, Clock clock) {
        if (hours < 0) {
            throw new IllegalArgumentException("La ventana temporal no puede ser negativa: " + hours + " h");
        }
        LocalDate yesterday = LocalDate.now(clock).minusDays(1);
        LocalDate date = LocalDate.of(
                year != null ? year : yesterday.getYear(),
                month != null ? month : yesterday.getMonthValue(),
                day != null ? day : yesterday.getDayOfMonth());
        LocalDateTime start = date.atStartOfDay();
        return new AnalysisWindow(start, start.plusHours(hours));
    }
}
