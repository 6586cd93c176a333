package tech.andrefsramos.offering_watcher.adapters.outbound.notify;

import java.util.ArrayList;
import java.util.List;

/*
 * Finalidade

 * Segmenta um texto em partes de no máximo {@code maxLen} caracteres, preferindo cortar na última
 * quebra de linha antes do limite. Sem quebra de linha disponível, corta exatamente no limite.
 * A parte seguinte começa sem as quebras de linha iniciais.
 */
public final class MessageChunker {

    public static final int TELEGRAM_MAX_CHARS = 4000;

    private MessageChunker() {}

    public static List<String> split(String text, int maxLen) {
        if (maxLen <= 0) {
            throw new IllegalArgumentException("maxLen deve ser positivo: " + maxLen);
        }
        List<String> out = new ArrayList<>();
        if (text == null) return out;

        String s = text;
        while (!s.isEmpty()) {
            if (s.length() <= maxLen) {
                out.add(s);
                break;
            }
            int cut = s.lastIndexOf('\n', maxLen - 1);
            if (cut <= 0) cut = maxLen;
            out.add(s.substring(0, cut));
            s = stripLeadingNewlines(s.substring(cut));
        }
        return out;
    }

    private static String stripLeadingNewlines(String s) {
        int i = 0;
        while (i < s.length() && s.charAt(i) == '\n') i++;
        return s.substring(i);
    }
}
