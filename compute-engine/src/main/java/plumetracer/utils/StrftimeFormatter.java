package plumetracer.utils;

import java.time.LocalDateTime;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * Resuelve plantillas con tokens tipo strftime (%Y, %m, %d...) contra una fecha.
 * <p>
 * Tokens soportados: %Y %y %m %d %H %M %S %j %b %B %a %A %%.
 * Un token desconocido se deja tal cual.
 */
public final class StrftimeFormatter {

    private StrftimeFormatter() {
    }

    public static String format(String template, LocalDateTime time) {
        if (template == null) {
            return null;
        }
        StringBuilder out = new StringBuilder(template.length() + 8);
        for (int k = 0; k < template.length(); k++) {
            char c = template.charAt(k);
            if (c != '%' || k == template.length() - 1) {
                out.append(c);
                continue;
            }
            char token = template.charAt(++k);
            switch (token) {
                case 'Y' -> out.append(String.format(Locale.ROOT, "%04d", time.getYear()));
                case 'y' -> out.append(String.format(Locale.ROOT, "%02d", time.getYear() % 100));
                case 'm' -> out.append(String.format(Locale.ROOT, "%02d", time.getMonthValue()));
                case 'd' -> out.append(String.format(Locale.ROOT, "%02d", time.getDayOfMonth()));
                case 'H' -> out.append(String.format(Locale.ROOT, "%02d", time.getHour()));
                case 'M' -> out.append(String.format(Locale.ROOT, "%02d", time.getMinute()));
                case 'S' -> out.append(String.format(Locale.ROOT, "%02d", time.getSecond()));
                case 'j' -> out.append(String.format(Locale.ROOT, "%03d", time.getDayOfYear()));
                case 'b' -> out.append(time.getMonth().getDisplayName(TextStyle.SHORT, Locale.ENGLISH));
                case 'B' -> out.append(time.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH));
                case 'a' -> out.append(time.getDayOfWeek().getDisplayName(TextStyle.SHORT, Locale.ENGLISH));
                case 'A' -> out.append(time.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH));
                case '%' -> out.append('%');
                default -> out.append('%').append(token);
            }
        }
        return out.toString();
    }
}
