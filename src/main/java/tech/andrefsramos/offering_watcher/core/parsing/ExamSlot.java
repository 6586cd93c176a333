package tech.andrefsramos.offering_watcher.core.parsing;

/** Data e hora da prova; ambos null quando o texto não traz um horário. */
public record ExamSlot(String date, String time) {

    public static final ExamSlot NONE = new ExamSlot(null, null);
}
