package tech.andrefsramos.offering_watcher.adapters.outbound.scrapers;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.offering_watcher.core.domain.Course;
import tech.andrefsramos.offering_watcher.core.domain.CourseRecordBuilder;
import tech.andrefsramos.offering_watcher.core.domain.Department;
import tech.andrefsramos.offering_watcher.core.domain.Grade;
import tech.andrefsramos.offering_watcher.core.domain.Snapshot;
import tech.andrefsramos.offering_watcher.core.domain.Term;
import tech.andrefsramos.offering_watcher.core.parsing.SafeNumbers;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/*
 * Finalidade

 * Extrai as ofertas de disciplinas de uma página de departamento já baixada.

 * Como funciona
 * - Período: célula "td.header[colspan=13]" com o padrão "نیمسال <rótulo> <AAAA>-<AAAA>".
 *   "اول" -> 1, "دوم" -> 2, outro rótulo -> 3; ano = SEGUNDO ano do intervalo.
 *   Sem cabeçalho, ano e semestre ficam 0 e a extração continua.
 * - Cada ".contentTable" tem o nível deduzido do texto da primeira linha do corpo.
 * - Linhas cuja primeira célula não é inteiro não negativo são cabeçalhos/separadores e são puladas.
 * - Cada linha de dados vira um Course (via {@link CourseRecordBuilder}) inserido no Snapshot do chamador.

 * Linha malformada nunca aborta a extração: o registro sai parcial.
 */
public class OfferingTableExtractor {

    private static final Logger log = LoggerFactory.getLogger(OfferingTableExtractor.class);

    private static final Pattern TERM_HEADER = Pattern.compile("نیمسال (\\S+) (\\d{4})-(\\d{4})");
    private static final String FIRST_SEMESTER = "اول";
    private static final String SECOND_SEMESTER = "دوم";

    public int extract(Document doc, Department department, Snapshot target) {
        if (doc == null) {
            log.warn("[Extract] Documento nulo para departamento={}; nada extraído.", department.code());
            return 0;
        }

        final Term term = parseTerm(doc);
        if (term.equals(Term.UNKNOWN)) {
            log.warn("[Extract] Cabeçalho de período ausente/ilegível departamento={}; ano/semestre = 0.", department.code());
        }

        int got = 0;
        int replaced = 0;
        int tables = 0;

        for (Element table : doc.select(".contentTable")) {
            tables++;
            final Grade grade = classify(table);
            final CourseRecordBuilder builder = new CourseRecordBuilder(department, term, grade);

            for (Element row : table.select("tr")) {
                Elements tds = row.select("td");
                if (tds.isEmpty()) continue;
                if (!SafeNumbers.isNonNegativeInteger(tds.first().text())) continue;

                List<String> cells = new ArrayList<>(tds.size());
                for (Element td : tds) cells.add(td.text());

                Course c = builder.fromCells(cells);
                if (target.put(c).isPresent()) {
                    replaced++;
                    if (log.isDebugEnabled()) {
                        log.debug("[Extract] Chave repetida key={}; registro anterior substituído.", c.key());
                    }
                }
                got++;
            }
        }

        log.info("[Extract] departamento={} tabelas={} cursos={} substituídos={} ano={} semestre={}",
                department.code(), tables, got, replaced, term.year(), term.semester());
        return got;
    }

    static Term parseTerm(Document doc) {
        Element header = doc.selectFirst("td.header[colspan=13]");
        if (header == null) return Term.UNKNOWN;
        return parseTerm(header.text());
    }

    static Term parseTerm(String headerText) {
        if (headerText == null) return Term.UNKNOWN;
        Matcher m = TERM_HEADER.matcher(headerText);
        if (!m.find()) return Term.UNKNOWN;

        int year = SafeNumbers.parseIntOrDefault(m.group(3), 0);
        String label = m.group(1);
        int semester;
        if (FIRST_SEMESTER.equals(label)) semester = 1;
        else if (SECOND_SEMESTER.equals(label)) semester = 2;
        else semester = 3;
        return new Term(year, semester);
    }

    static Grade classify(Element table) {
        Element firstBodyRow = table.selectFirst("tbody tr");
        if (firstBodyRow == null) return Grade.BS;
        String text = firstBodyRow.select("td").stream()
                .map(Element::text)
                .collect(Collectors.joining(" "));
        return Grade.fromRowText(text);
    }
}
