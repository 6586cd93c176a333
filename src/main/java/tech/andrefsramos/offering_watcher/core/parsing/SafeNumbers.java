package tech.andrefsramos.offering_watcher.core.parsing;

import java.util.OptionalInt;

/*
 * Conversão numérica sem exceções: texto inválido vira OptionalInt vazio e o chamador decide o default.
 * Aceita dígitos Unicode (o portal pode servir algarismos persas), sinal opcional e espaços nas bordas.
 */
public final class SafeNumbers {

    private SafeNumbers() {}

    public static OptionalInt tryParseInt(String text) {
        if (text == null) return OptionalInt.empty();
        String s = text.strip();
        if (s.isEmpty()) return OptionalInt.empty();

        int i = 0;
        boolean negative = false;
        char first = s.charAt(0);
        if (first == '+' || first == '-') {
            negative = first == '-';
            i = 1;
        }
        if (i == s.length()) return OptionalInt.empty();

        long value = 0;
        for (; i < s.length(); i++) {
            int d = Character.digit(s.charAt(i), 10);
            if (d < 0) return OptionalInt.empty();
            value = value * 10 + d;
            if (value > (long) Integer.MAX_VALUE + 1) return OptionalInt.empty();
        }
        if (negative) value = -value;
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) return OptionalInt.empty();
        return OptionalInt.of((int) value);
    }

    public static int parseIntOrDefault(String text, int fallback) {
        return tryParseInt(text).orElse(fallback);
    }

    /** Literal inteiro não negativo (somente dígitos). É assim que linhas de dados são reconhecidas. */
    public static boolean isNonNegativeInteger(String text) {
        if (text == null || text.isEmpty()) return false;
        for (int i = 0; i < text.length(); i++) {
            if (!Character.isDigit(text.charAt(i))) return false;
        }
        return true;
    }
}
