package tech.andrefsramos.offering_watcher.core.domain;

public enum Grade {
    BS("bs"),
    MS("ms"),
    PHD("phd");

    private static final String MASTERS_KEYWORD = "کارشناسی ارشد";
    private static final String DOCTORAL_KEYWORD = "دکترا";

    private final String code;

    Grade(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Classifica o nível da tabela pelo texto combinado da primeira linha do corpo.
     * Sem palavra-chave reconhecida, assume graduação.
     */
    public static Grade fromRowText(String rowText) {
        if (rowText == null) return BS;
        if (rowText.contains(MASTERS_KEYWORD)) return MS;
        if (rowText.contains(DOCTORAL_KEYWORD)) return PHD;
        return BS;
    }
}
