package tech.andrefsramos.offering_watcher.adapters.outbound.scrapers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.offering_watcher.core.domain.Department;
import tech.andrefsramos.offering_watcher.core.parsing.SafeNumbers;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/*
 * Finalidade

 * Catálogo dos departamentos do portal (depID -> nome armazenado com "_" no lugar de espaço).
 * A configuração pode restringir o conjunto observado por uma lista de ids; lista vazia = todos.
 */
public final class DepartmentCatalog {

    private static final Logger log = LoggerFactory.getLogger(DepartmentCatalog.class);

    private static final Map<Integer, String> KNOWN;

    static {
        Map<Integer, String> m = new LinkedHashMap<>();
        m.put(20, "مهندسی_عمران");
        m.put(21, "مهندسی_صنایع");
        m.put(22, "علوم_ریاضی");
        m.put(23, "شیمی");
        m.put(24, "فیزیک");
        m.put(25, "مهندسی_برق");
        m.put(26, "مهندسی_شیمی_و_نفت");
        m.put(27, "مهندسی_و_علم_مواد");
        m.put(28, "مهندسی_مکانیک");
        m.put(29, "پژوهشکده_سیاست‏گذاری_علم،_فناوری_و_صنعت");
        m.put(30, "مرکز_تربیت_بدنی");
        m.put(31, "مرکز_زبان‌ها_و_زبان‌شناسی");
        m.put(33, "مرکز_آموزش_مهارت‌های_مهندسی");
        m.put(34, "پژوهشکده_علوم_و_فن‌آوری_انرژی،_آب_و_محیط_زیست");
        m.put(35, "مرکز_گرافیک_(مرکز_آموزش_مهارت‌های_مهندسی)");
        m.put(37, "مرکز_معارف_اسلامی_و_علوم_انسانی");
        m.put(38, "بیوشیمی");
        m.put(39, "پژوهشکده_الکترونيک");
        m.put(40, "مهندسی_کامپیوتر");
        m.put(41, "گروه_برنامه‌ریزی_سیستم‌ها");
        m.put(42, "گروه_فلسفه_علم");
        m.put(43, "مهندسی_سیستم‌های_انرژی");
        m.put(44, "مدیریت_و_اقتصاد");
        m.put(45, "مهندسی_هوافضا");
        m.put(46, "مهندسی_انرژی");
        m.put(47, "پژوهشکده_فناوری_اطلاعات_و_ارتباطات_پیشرفته");
        m.put(48, "پژوهشکده_علوم_و_فن‌آوری_نانو");
        m.put(49, "طرح_مهمان_تکدرس");
        m.put(50, "دروس_پایه_و_عمومی_(پردیس_کیش)");
        m.put(51, "مهندسی_صنایع_(پردیس_کیش)");
        m.put(52, "مهندسی_کامپیوتر_(پردیس_کیش)");
        m.put(53, "مهندسی_عمران_(پردیس_کیش)");
        m.put(54, "مدیریت_(پردیس_کیش)");
        m.put(55, "مهندسی_برق_(پردیس_کیش)");
        m.put(56, "مهندسی_نانوفناوری_(پردیس_کیش)");
        m.put(57, "مهندسی_مواد_(پردیس_کیش)");
        m.put(58, "مهندسی_مکانیک_(پردیس_کیش)");
        m.put(59, "زبان‌ها_و_زبان‌شناسی_(پردیس_کیش)");
        m.put(61, "طرح_مهمان_تک_درس_(پردیس_کیش)");
        m.put(65, "مهندسی_هوافضا_(پردیس_کیش)");
        m.put(66, "مهندسی_شیمی_و_نفت_(پردیس_کیش)");
        m.put(70, "دروس_پایه_و_عمومی_(پردیس_تهران)");
        m.put(71, "طرح_مهمان_تک_درس_(پردیس_تهران)");
        m.put(73, "مهندسی_عمران_(پردیس_تهران)");
        m.put(76, "مهندسی_نفت_(پردیس_تهران)");
        m.put(77, "مهندسی_مواد_(پردیس_تهران)");
        m.put(78, "مهندسی_مکانیک_(پردیس_تهران)");
        m.put(79, "مهندسی_مکاترونیک_(پردیس_تهران)");
        m.put(80, "مهندسی_فناوری_اطلاعات_(پردیس_تهران)");
        m.put(81, "مهندسی_کامپیوتر(پردیس_تهران)");
        KNOWN = Collections.unmodifiableMap(m);
    }

    private DepartmentCatalog() {}

    public static List<Department> all() {
        List<Department> out = new ArrayList<>(KNOWN.size());
        KNOWN.forEach((code, name) -> out.add(new Department(code, name)));
        return out;
    }

    /**
     * Departamentos selecionados pelos ids informados, na ordem do catálogo.
     * Ids inválidos ou desconhecidos são ignorados com WARN; nenhum id válido = catálogo inteiro.
     */
    public static List<Department> select(Collection<String> ids) {
        if (ids == null) return all();

        List<Integer> wanted = new ArrayList<>();
        for (String raw : ids) {
            if (raw == null || raw.isBlank()) continue;
            OptionalInt id = SafeNumbers.tryParseInt(raw);
            if (id.isEmpty() || !KNOWN.containsKey(id.getAsInt())) {
                log.warn("[Departments] Id de departamento desconhecido '{}'; ignorado.", raw.trim());
                continue;
            }
            wanted.add(id.getAsInt());
        }
        if (wanted.isEmpty()) return all();

        List<Department> out = new ArrayList<>();
        KNOWN.forEach((code, name) -> {
            if (wanted.contains(code)) out.add(new Department(code, name));
        });
        return out;
    }
}
