package tech.andrefsramos.offering_watcher.adapters.outbound.scrapers;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;
import tech.andrefsramos.offering_watcher.core.domain.Course;
import tech.andrefsramos.offering_watcher.core.domain.CourseSession;
import tech.andrefsramos.offering_watcher.core.domain.Department;
import tech.andrefsramos.offering_watcher.core.domain.Snapshot;
import tech.andrefsramos.offering_watcher.core.domain.Term;

import static org.assertj.core.api.Assertions.assertThat;

class OfferingTableExtractorTest {

    private static final String HEADER = "<table><tr><td class=\"header\" colspan=\"13\">"
            + "لیست دروس ارائه شده نیمسال اول 1403-1404</td></tr></table>";

    private final OfferingTableExtractor extractor = new OfferingTableExtractor();
    private final Department computer = new Department(40, "مهندسی_کامپیوتر");

    private static String table(String levelRow, String... rows) {
        StringBuilder sb = new StringBuilder("<table class=\"contentTable\"><tbody>");
        sb.append("<tr><td colspan=\"12\">").append(levelRow).append("</td></tr>");
        sb.append("<tr><td>کد درس</td><td>گروه</td><td>واحد</td><td>نام درس</td></tr>");
        for (String r : rows) sb.append(r);
        return sb.append("</tbody></table>").toString();
    }

    private static String row(String... cells) {
        StringBuilder sb = new StringBuilder("<tr>");
        for (String c : cells) sb.append("<td>").append(c).append("</td>");
        return sb.append("</tr>").toString();
    }

    private static final String ALGORITHMS = row("12345", "1", "3", "Algorithms", "", "40", "38", "Dr. A",
            "1403/10/12 14:00", "شنبه از 08:00 تا 09:30", "", "notes");

    @Test
    void extractsDataRowsIntoSnapshot() {
        Document doc = Jsoup.parse("<html><body>" + HEADER + table("دروس کارشناسی", ALGORITHMS) + "</body></html>");
        Snapshot target = new Snapshot();

        int got = extractor.extract(doc, computer, target);

        assertThat(got).isEqualTo(1);
        Course c = target.get("12345-1").orElseThrow();
        assertThat(c.grade()).isEqualTo("bs");
        assertThat(c.group()).isEqualTo(1);
        assertThat(c.units()).isEqualTo(3);
        assertThat(c.capacity()).isEqualTo(40);
        assertThat(c.registered()).isEqualTo(38);
        assertThat(c.examDate()).isEqualTo("1403/10/12");
        assertThat(c.examTime()).isEqualTo("14:00");
        assertThat(c.sessions()).containsExactly(new CourseSession(0, "08:00", "09:30"));
        assertThat(c.info()).isEqualTo("notes");
        assertThat(c.department()).isEqualTo("مهندسی کامپیوتر");
        assertThat(c.departmentCode()).isEqualTo(40);
        assertThat(c.year()).isEqualTo(1404);
        assertThat(c.semester()).isEqualTo(1);
    }

    @Test
    void classifiesEachTableByItsFirstBodyRow() {
        String ms = table("دروس کارشناسی ارشد", row("40800", "1", "3", "Advanced ML"));
        String phd = table("دروس دکترا", row("40900", "1", "3", "Seminar"));
        Document doc = Jsoup.parse(HEADER + ms + phd);
        Snapshot target = new Snapshot();

        extractor.extract(doc, computer, target);

        assertThat(target.get("40800-1").orElseThrow().grade()).isEqualTo("ms");
        assertThat(target.get("40900-1").orElseThrow().grade()).isEqualTo("phd");
    }

    @Test
    void missingHeaderStillExtractsWithZeroTerm() {
        Document doc = Jsoup.parse(table("", ALGORITHMS));
        Snapshot target = new Snapshot();

        assertThat(extractor.extract(doc, computer, target)).isEqualTo(1);
        Course c = target.get("12345-1").orElseThrow();
        assertThat(c.year()).isZero();
        assertThat(c.semester()).isZero();
    }

    @Test
    void repeatedKeyKeepsLastRow() {
        String again = row("12345", "1", "3", "Algorithms II", "", "45", "39", "Dr. B");
        Document doc = Jsoup.parse(HEADER + table("", ALGORITHMS, again));
        Snapshot target = new Snapshot();

        int got = extractor.extract(doc, computer, target);

        assertThat(got).isEqualTo(2);
        assertThat(target.size()).isEqualTo(1);
        assertThat(target.get("12345-1").orElseThrow().name()).isEqualTo("Algorithms II");
    }

    @Test
    void pageWithoutTablesExtractsNothing() {
        Snapshot target = new Snapshot();

        assertThat(extractor.extract(Jsoup.parse("<p>vazio</p>"), computer, target)).isZero();
        assertThat(extractor.extract(null, computer, target)).isZero();
        assertThat(target.isEmpty()).isTrue();
    }

    @Test
    void termHeaderLabels() {
        assertThat(OfferingTableExtractor.parseTerm("نیمسال اول 1403-1404")).isEqualTo(new Term(1404, 1));
        assertThat(OfferingTableExtractor.parseTerm("نیمسال دوم 1403-1404")).isEqualTo(new Term(1404, 2));
        assertThat(OfferingTableExtractor.parseTerm("نیمسال تابستان 1403-1404")).isEqualTo(new Term(1404, 3));
        assertThat(OfferingTableExtractor.parseTerm("بدون دوره")).isEqualTo(Term.UNKNOWN);
    }
}
