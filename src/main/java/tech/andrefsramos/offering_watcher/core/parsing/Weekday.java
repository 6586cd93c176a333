package tech.andrefsramos.offering_watcher.core.parsing;

import java.util.Optional;

/**
 * Dias da semana do calendário iraniano, começando no sábado (índice 0).
 * O portal escreve "سه شنبه" com espaço; no relatório usamos a forma com ZWNJ.
 */
public enum Weekday {
    SATURDAY("شنبه", "شنبه"),
    SUNDAY("یکشنبه", "یکشنبه"),
    MONDAY("دوشنبه", "دوشنبه"),
    TUESDAY("سه شنبه", "سه‌شنبه"),
    WEDNESDAY("چهارشنبه", "چهارشنبه"),
    THURSDAY("پنجشنبه", "پنجشنبه"),
    FRIDAY("جمعه", "جمعه");

    private final String portalName;
    private final String displayName;

    Weekday(String portalName, String displayName) {
        this.portalName = portalName;
        this.displayName = displayName;
    }

    public int index() {
        return ordinal();
    }

    public String displayName() {
        return displayName;
    }

    public static Optional<Weekday> fromPortalName(String name) {
        if (name == null) return Optional.empty();
        for (Weekday d : values()) {
            if (d.portalName.equals(name)) return Optional.of(d);
        }
        return Optional.empty();
    }

    public static Optional<Weekday> fromIndex(int index) {
        if (index < 0 || index >= values().length) return Optional.empty();
        return Optional.of(values()[index]);
    }
}
