package tech.andrefsramos.offering_watcher.core.domain;

import tech.andrefsramos.offering_watcher.core.parsing.ExamSlot;
import tech.andrefsramos.offering_watcher.core.parsing.SafeNumbers;
import tech.andrefsramos.offering_watcher.core.parsing.ScheduleTextParser;

import java.util.List;

/*
 * Finalidade

 * Monta um {@link Course} normalizado a partir das células de uma linha da tabela de oferta
 * e do contexto da página (departamento, período, nível).

 * Mapa de colunas
 *  0 código | 1 turma | 2 créditos | 3 nome | 5 capacidade | 6 inscritos | 7 professor
 *  8 prova (data + hora) | 9 horário semanal | 11 observações
 * As colunas 4 e 10 não são usadas. Números inválidos ficam em 0; células ausentes mantêm o default.
 */
public final class CourseRecordBuilder {

    static final int COL_CODE = 0;
    static final int COL_GROUP = 1;
    static final int COL_UNITS = 2;
    static final int COL_NAME = 3;
    static final int COL_CAPACITY = 5;
    static final int COL_REGISTERED = 6;
    static final int COL_LECTURER = 7;
    static final int COL_EXAM = 8;
    static final int COL_SCHEDULE = 9;
    static final int COL_INFO = 11;

    private final Department department;
    private final Term term;
    private final Grade grade;

    public CourseRecordBuilder(Department department, Term term, Grade grade) {
        this.department = department;
        this.term = term != null ? term : Term.UNKNOWN;
        this.grade = grade != null ? grade : Grade.BS;
    }

    public Course fromCells(List<String> cells) {
        ExamSlot exam = ScheduleTextParser.splitExam(cell(cells, COL_EXAM));

        return new Course(
                textOrEmpty(cells, COL_CODE),
                intCell(cells, COL_GROUP),
                textOrEmpty(cells, COL_NAME),
                textOrEmpty(cells, COL_LECTURER),
                intCell(cells, COL_CAPACITY),
                intCell(cells, COL_REGISTERED),
                intCell(cells, COL_UNITS),
                exam.date(),
                exam.time(),
                ScheduleTextParser.parseWeeklySchedule(cell(cells, COL_SCHEDULE)),
                ScheduleTextParser.trimToNull(cell(cells, COL_INFO)),
                department != null ? department.displayName() : "",
                department != null ? department.code() : 0,
                grade.code(),
                term.year(),
                term.semester()
        );
    }

    private static String cell(List<String> cells, int index) {
        return (cells != null && index < cells.size()) ? cells.get(index) : null;
    }

    private static String textOrEmpty(List<String> cells, int index) {
        String v = cell(cells, index);
        return v == null ? "" : v;
    }

    private static int intCell(List<String> cells, int index) {
        return SafeNumbers.parseIntOrDefault(cell(cells, index), 0);
    }
}
