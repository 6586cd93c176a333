package tech.andrefsramos.offering_watcher.adapters.outbound.persistence;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import tech.andrefsramos.offering_watcher.core.domain.Course;
import tech.andrefsramos.offering_watcher.core.domain.CourseSession;
import tech.andrefsramos.offering_watcher.core.domain.Snapshot;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/*
 * Finalidade

 * Forma persistida do Snapshot: objeto JSON "código-turma" -> registro com os campos
 * Code, Group, Name, Lecturer, Capacity, Registered, Units, ExamDate, ExamTime, Sessions,
 * Info, Department, DepartmentCode, Grade, Year, Semester (nesta ordem).
 * Sessions é uma lista de {day_of_week, start_time, end_time}; opcionais ausentes viram null.

 * A leitura é tolerante: campos numéricos ausentes assumem 0, textos obrigatórios ausentes
 * assumem "" e campos desconhecidos são ignorados.
 */
public class SnapshotJsonCodec {

    private static final TypeReference<LinkedHashMap<String, CourseDocument>> DOCUMENT_MAP =
            new TypeReference<>() {};

    private final ObjectMapper mapper;

    public SnapshotJsonCodec(ObjectMapper mapper) {
        this.mapper = mapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String encode(Snapshot snapshot) {
        Map<String, CourseDocument> out = new LinkedHashMap<>();
        snapshot.asMap().forEach((key, course) -> out.put(key, CourseDocument.from(course)));
        try {
            return mapper.writeValueAsString(out);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Falha ao serializar snapshot (size=" + snapshot.size() + ")", e);
        }
    }

    public Snapshot decode(String json) {
        if (json == null || json.isBlank()) return new Snapshot();
        try {
            Map<String, CourseDocument> docs = mapper.readValue(json, DOCUMENT_MAP);
            Map<String, Course> courses = new LinkedHashMap<>();
            if (docs != null) {
                docs.forEach((key, doc) -> {
                    if (doc != null) courses.put(key, doc.toCourse());
                });
            }
            return new Snapshot(courses);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("JSON de snapshot inválido: " + e.getOriginalMessage(), e);
        }
    }

    @JsonInclude(JsonInclude.Include.ALWAYS)
    @JsonPropertyOrder({"day_of_week", "start_time", "end_time"})
    record SessionDocument(
            @JsonProperty("day_of_week") Integer dayOfWeek,
            @JsonProperty("start_time") String startTime,
            @JsonProperty("end_time") String endTime
    ) {
        static SessionDocument from(CourseSession s) {
            return new SessionDocument(s.dayOfWeek(), s.startTime(), s.endTime());
        }

        CourseSession toSession() {
            return new CourseSession(intOrZero(dayOfWeek), textOrEmpty(startTime), textOrEmpty(endTime));
        }
    }

    @JsonInclude(JsonInclude.Include.ALWAYS)
    @JsonPropertyOrder({"Code", "Group", "Name", "Lecturer", "Capacity", "Registered", "Units", "ExamDate",
            "ExamTime", "Sessions", "Info", "Department", "DepartmentCode", "Grade", "Year", "Semester"})
    record CourseDocument(
            @JsonProperty("Code") String code,
            @JsonProperty("Group") Integer group,
            @JsonProperty("Name") String name,
            @JsonProperty("Lecturer") String lecturer,
            @JsonProperty("Capacity") Integer capacity,
            @JsonProperty("Registered") Integer registered,
            @JsonProperty("Units") Integer units,
            @JsonProperty("ExamDate") String examDate,
            @JsonProperty("ExamTime") String examTime,
            @JsonProperty("Sessions") List<SessionDocument> sessions,
            @JsonProperty("Info") String info,
            @JsonProperty("Department") String department,
            @JsonProperty("DepartmentCode") Integer departmentCode,
            @JsonProperty("Grade") String grade,
            @JsonProperty("Year") Integer year,
            @JsonProperty("Semester") Integer semester
    ) {
        static CourseDocument from(Course c) {
            List<SessionDocument> sessions = new ArrayList<>(c.sessions().size());
            for (CourseSession s : c.sessions()) sessions.add(SessionDocument.from(s));
            return new CourseDocument(c.code(), c.group(), c.name(), c.lecturer(), c.capacity(), c.registered(),
                    c.units(), c.examDate(), c.examTime(), sessions, c.info(), c.department(), c.departmentCode(),
                    c.grade(), c.year(), c.semester());
        }

        Course toCourse() {
            List<CourseSession> out = new ArrayList<>();
            if (sessions != null) {
                for (SessionDocument s : sessions) {
                    if (s != null) out.add(s.toSession());
                }
            }
            return new Course(textOrEmpty(code), intOrZero(group), textOrEmpty(name), textOrEmpty(lecturer),
                    intOrZero(capacity), intOrZero(registered), intOrZero(units), examDate, examTime, out, info,
                    textOrEmpty(department), intOrZero(departmentCode), textOrEmpty(grade), intOrZero(year),
                    intOrZero(semester));
        }
    }

    private static int intOrZero(Integer v) {
        return v == null ? 0 : v;
    }

    private static String textOrEmpty(String v) {
        return v == null ? "" : v;
    }
}
