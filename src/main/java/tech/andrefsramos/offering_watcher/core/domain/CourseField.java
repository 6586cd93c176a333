package tech.andrefsramos.offering_watcher.core.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/*
 * Finalidade

 * Tabela fechada dos campos de um {@link Course}, na ordem da forma persistida (JSON).
 * Cada entrada conhece:
 *  - o nome do campo no JSON ("Code", "Registered", ...);
 *  - o rótulo exibido no relatório;
 *  - o acessor que lê o valor do registro.

 * É a representação serializada usada pelo DetectChanges e pelo relatório; nada aqui usa reflexão.
 */
public enum CourseField {
    CODE("Code", "کد درس", Course::code),
    GROUP("Group", "گروه درس", Course::group),
    NAME("Name", "🪧 نام درس", Course::name),
    LECTURER("Lecturer", "👨‍🏫 استاد", Course::lecturer),
    CAPACITY("Capacity", "📊 ظرفیت", Course::capacity),
    REGISTERED("Registered", "📈 ثبت نامی", Course::registered),
    UNITS("Units", "واحد", Course::units),
    EXAM_DATE("ExamDate", "📅 تاریخ آزمون", Course::examDate),
    EXAM_TIME("ExamTime", "🕒 ساعت آزمون", Course::examTime),
    SESSIONS("Sessions", "🗓️ برنامه هفتگی", Course::sessions),
    INFO("Info", "💬 توضیحات", Course::info),
    DEPARTMENT("Department", "دانشکده", Course::department),
    DEPARTMENT_CODE("DepartmentCode", "کد دانشکده", Course::departmentCode),
    GRADE("Grade", "مقطع", Course::grade),
    YEAR("Year", "سال", Course::year),
    SEMESTER("Semester", "ترم", Course::semester);

    private static final Map<String, CourseField> BY_JSON_NAME = new LinkedHashMap<>();

    static {
        for (CourseField f : values()) BY_JSON_NAME.put(f.jsonName, f);
    }

    private final String jsonName;
    private final String label;
    private final Function<Course, Object> accessor;

    CourseField(String jsonName, String label, Function<Course, Object> accessor) {
        this.jsonName = jsonName;
        this.label = label;
        this.accessor = accessor;
    }

    public String jsonName() {
        return jsonName;
    }

    public String label() {
        return label;
    }

    public Object read(Course course) {
        return accessor.apply(course);
    }

    public static Optional<CourseField> byJsonName(String name) {
        return Optional.ofNullable(BY_JSON_NAME.get(name));
    }

    /** Rótulo do campo; nomes fora da tabela são exibidos como vieram. */
    public static String labelOf(String jsonName) {
        return byJsonName(jsonName).map(CourseField::label).orElse(jsonName);
    }

    /** Forma serializada do registro: nome JSON -> valor, na ordem da tabela. Valores podem ser null. */
    public static Map<String, Object> valuesOf(Course course) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (CourseField f : values()) out.put(f.jsonName, f.read(course));
        return Collections.unmodifiableMap(out);
    }
}
