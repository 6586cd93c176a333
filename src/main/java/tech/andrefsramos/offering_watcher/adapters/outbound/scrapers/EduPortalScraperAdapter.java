package tech.andrefsramos.offering_watcher.adapters.outbound.scrapers;

import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import tech.andrefsramos.offering_watcher.adapters.outbound.http.HttpSession;
import tech.andrefsramos.offering_watcher.core.domain.Department;
import tech.andrefsramos.offering_watcher.core.domain.Snapshot;
import tech.andrefsramos.offering_watcher.core.ports.ScraperPort;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/*
 * Finalidade

 * Adapter de saída para o portal de matrícula (edu). Mantém a sessão autenticada e baixa a página
 * de oferta de cada departamento, delegando a extração ao {@link OfferingTableExtractor}.

 * Fluxo de openSession()
 *  1) GET na raiz do portal (precisa ser 200) para receber os cookies iniciais.
 *  2) POST em login.do com as credenciais; o corpo precisa conter o marcador de logout ("خروج").
 *  3) Aquecimento: POST em action.do (menu de matrícula) e em register.do (lista oficial de ofertas).

 * Fluxo de collectDepartment()
 *  - POST em register.do com depID; status != 200 ou redirecionamento para o login é fatal
 *    ({@link EduPortalException}); o corpo é parseado e extraído para o Snapshot do chamador.
 */
@Component
public class EduPortalScraperAdapter implements ScraperPort {

    private static final Logger log = LoggerFactory.getLogger(EduPortalScraperAdapter.class);

    static final String LOGIN_REDIRECT_MARKER =
            "https://accounts.sharif.edu/cas/login?service=https://edu.sharif.edu/login.jsp";
    static final String LOGGED_IN_MARKER = "خروج";
    private static final long LOGIN_PAUSE_MS = 1000;

    private final String baseUrl;
    private final String username;
    private final String password;
    private final int timeoutMs;
    private final int retries;
    private final OfferingTableExtractor extractor = new OfferingTableExtractor();

    private HttpSession session;

    public EduPortalScraperAdapter(
            @Value("${app.edu.baseUrl:https://edu.sharif.edu}") String baseUrl,
            @Value("${app.edu.username:}") String username,
            @Value("${app.edu.password:}") String password,
            @Value("${app.edu.timeoutMs:30000}") int timeoutMs,
            @Value("${app.edu.retries:1}") int retries
    ) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.username = username;
        this.password = password;
        this.timeoutMs = timeoutMs;
        this.retries = retries;
    }

    @Override
    public void openSession() {
        final long t0 = System.nanoTime();
        if (username == null || username.isBlank() || password == null || password.isBlank()) {
            throw new EduPortalException("Credenciais do portal não configuradas (app.edu.username / app.edu.password)");
        }

        HttpSession s = new HttpSession(timeoutMs, retries, 1000);

        Connection.Response root = call(() -> s.get(baseUrl + "/"), "GET /");
        requireOk(root, "GET /");

        sleep(LOGIN_PAUSE_MS);

        Map<String, String> loginForm = new LinkedHashMap<>();
        loginForm.put("username", username);
        loginForm.put("password", password);
        loginForm.put("jcaptcha", "ab");
        loginForm.put("command", "login");
        loginForm.put("captcha_key_name", "ab");
        loginForm.put("captchaStatus", "ab");
        Connection.Response login = call(() -> s.post(baseUrl + "/login.do", loginForm), "POST /login.do");
        if (!login.body().contains(LOGGED_IN_MARKER)) {
            throw new EduPortalException("Login recusado pelo portal (marcador de logout ausente)", login.statusCode());
        }

        this.session = s;
        warmUp();

        log.info("[EduPortal] Sessão aberta usuário={} cookies={} ({} ms)",
                username, s.cookieCount(), (System.nanoTime() - t0) / 1_000_000);
    }

    @Override
    public int collectDepartment(Department department, Snapshot target) {
        Document doc = fetchDepartmentPage(department);
        return extractor.extract(doc, department, target);
    }

    Document fetchDepartmentPage(Department department) {
        HttpSession s = requireSession();

        Map<String, String> form = new LinkedHashMap<>();
        form.put("level", "0");
        form.put("teacher_name", "");
        form.put("sort_item", "1");
        form.put("depID", String.valueOf(department.code()));

        String step = "POST /register.do depID=" + department.code();
        Connection.Response r = call(() -> s.post(baseUrl + "/register.do", form), step);
        requireOk(r, step);
        String body = r.body();
        requireNotLogin(body, step);

        if (log.isDebugEnabled()) {
            log.debug("[EduPortal] Página recebida departamento={} bytes={}", department.code(), body.length());
        }
        return Jsoup.parse(body, baseUrl + "/register.do");
    }

    private void warmUp() {
        HttpSession s = requireSession();

        Map<String, String> menu = new LinkedHashMap<>();
        menu.put("changeMenu", "OnlineRegistration");
        menu.put("isShowMenu", "");
        menu.put("commandMessage", "");
        menu.put("defaultCss", "");
        Connection.Response r1 = call(() -> s.post(baseUrl + "/action.do", menu), "POST /action.do");
        requireOk(r1, "POST /action.do");
        requireNotLogin(r1.body(), "POST /action.do");

        Map<String, String> list = new LinkedHashMap<>();
        list.put("changeMenu", "OnlineRegistration*OfficalLessonListShow");
        list.put("isShowMenu", "");
        Connection.Response r2 = call(() -> s.post(baseUrl + "/register.do", list), "POST /register.do (menu)");
        requireOk(r2, "POST /register.do (menu)");
        requireNotLogin(r2.body(), "POST /register.do (menu)");

        log.debug("[EduPortal] Aquecimento concluído.");
    }

    static boolean isLoginPage(String body) {
        return body != null && body.contains(LOGIN_REDIRECT_MARKER);
    }

    private HttpSession requireSession() {
        if (session == null) {
            throw new EduPortalException("Sessão do portal não inicializada (openSession não executado)");
        }
        return session;
    }

    private static void requireOk(Connection.Response r, String step) {
        if (r.statusCode() != 200) {
            throw new EduPortalException("Status inesperado em " + step + ": " + r.statusCode(), r.statusCode());
        }
    }

    private void requireNotLogin(String body, String step) {
        if (isLoginPage(body)) {
            this.session = null;
            throw new EduPortalException("Redirecionado para a página de login em " + step, 200);
        }
    }

    private static Connection.Response call(IoCall call, String step) {
        try {
            return call.run();
        } catch (IOException e) {
            throw new EduPortalException("Falha de transporte em " + step + ": " + e.getMessage(), -1, e);
        }
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) return "";
        String u = url.trim();
        return u.endsWith("/") ? u.substring(0, u.length() - 1) : u;
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new EduPortalException("Interrompido durante o login");
        }
    }

    @FunctionalInterface
    private interface IoCall {
        Connection.Response run() throws IOException;
    }
}
