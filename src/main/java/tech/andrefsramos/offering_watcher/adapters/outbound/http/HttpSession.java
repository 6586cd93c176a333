package tech.andrefsramos.offering_watcher.adapters.outbound.http;

import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * HttpSession

 * Finalidade

 * Encapsula uma sessão HTTP baseada em Jsoup para o portal de matrícula:
 *   - Persistência de cookies entre chamadas (a autenticação vive no cookie de sessão).
 *   - Cabeçalhos padrão (User-Agent, Accept, Accept-Language).
 *   - GET e POST de formulário com retry simples apenas para falhas de I/O.

 * Status HTTP não-2xx NÃO geram retry: a resposta é devolvida e o chamador decide
 * (o portal responde 200 mesmo quando redireciona para o login).
 */
public class HttpSession {

    private static final Logger log = LoggerFactory.getLogger(HttpSession.class);

    private static final String UA_PRIMARY =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/114.0.0.0 Safari/537.36";
    private static final String ACCEPT =
            "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";
    private static final String ACCEPT_LANG =
            "fa-IR,fa;q=0.9,en-US;q=0.8,en;q=0.7";

    private final Map<String, String> cookies = new HashMap<>();

    private final int timeoutMs;
    private final int retries;
    private final long backoffMs;

    public HttpSession(int timeoutMs, int retries, long backoffMs) {
        this.timeoutMs = timeoutMs;
        this.retries = retries;
        this.backoffMs = backoffMs;
    }

    public Connection.Response get(String url) throws IOException {
        return execute(url, Connection.Method.GET, Map.of());
    }

    public Connection.Response post(String url, Map<String, String> form) throws IOException {
        return execute(url, Connection.Method.POST, form);
    }

    public int cookieCount() {
        return cookies.size();
    }

    private Connection.Response execute(String url, Connection.Method method, Map<String, String> form) throws IOException {
        long globalStart = System.nanoTime();
        IOException last = null;

        for (int attempt = 0; attempt <= Math.max(0, retries); attempt++) {
            if (attempt > 0) sleep(backoffMs);
            try {
                Connection.Response r = tryOnce(url, method, form, attempt);
                if (attempt > 0) {
                    log.info("HttpSession: sucesso na tentativa={} {} url={}", attempt, method, url);
                }
                return r;
            } catch (IOException ex) {
                last = ex;
                log.warn("HttpSession: falha de I/O tentativa={} {} url={} msg={}", attempt, method, url, ex.getMessage());
            }
        }

        long elapsedMs = (System.nanoTime() - globalStart) / 1_000_000;
        log.error("HttpSession: esgotadas as tentativas {} url={} elapsedMs={} ms", method, url, elapsedMs);
        throw last != null ? last : new IOException("Falha sem causa registrada: " + url);
    }

    private Connection.Response tryOnce(String url, Connection.Method method, Map<String, String> form, int attempt)
            throws IOException {
        long start = System.nanoTime();
        Connection conn = Jsoup.connect(url)
                .userAgent(UA_PRIMARY)
                .timeout(timeoutMs)
                .maxBodySize(0)
                .followRedirects(true)
                .ignoreHttpErrors(true)
                .header("Accept", ACCEPT)
                .header("Accept-Language", ACCEPT_LANG)
                .method(method);

        if (!cookies.isEmpty()) {
            conn.cookies(cookies);
        }
        if (form != null && !form.isEmpty()) {
            conn.data(form);
        }

        Connection.Response r = conn.execute();
        cookies.putAll(r.cookies());

        if (log.isDebugEnabled()) {
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            log.debug("HttpSession.tryOnce: tentativa={} {} url={} status={} elapsedMs={}ms contentType={} cookiesAcumulados={}",
                    attempt, method, url, r.statusCode(), elapsedMs, r.contentType(), cookies.size());
        }
        return r;
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
