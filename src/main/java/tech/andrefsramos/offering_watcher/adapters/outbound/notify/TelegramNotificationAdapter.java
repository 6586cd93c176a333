package tech.andrefsramos.offering_watcher.adapters.outbound.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import tech.andrefsramos.offering_watcher.core.domain.ChangeReport;
import tech.andrefsramos.offering_watcher.core.ports.NotificationPort;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * TelegramNotificationAdapter

 * Finalidade

 * Entrega o relatório de mudanças num chat do Telegram via sendMessage da Bot API.

 * Funcionamento

 * 1) Envia a faixa de tempo "```Time [anterior] ➡️ [atual] ```" em MarkdownV2.
 * 2) Para cada bloco de departamento: escapa o texto para HTML, segmenta em partes
 *    de até {@code maxMessageChars} ({@link MessageChunker}) e envia cada parte em modo HTML.
 * 3) Pausa {@code batchDelayMs} entre mensagens; HTTP 429 respeita o Retry-After (até 3 tentativas).
 */
@Component
@ConditionalOnProperty(prefix = "app.notify.telegram", name = "enabled", havingValue = "true")
public class TelegramNotificationAdapter implements NotificationPort {

    private static final Logger log = LoggerFactory.getLogger(TelegramNotificationAdapter.class);

    static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    static final String UNKNOWN_TIME = "N/A";

    private final String botToken;
    private final String chatId;
    private final String apiBaseUrl;
    private final int connectTimeoutMs;
    private final int readTimeoutMs;
    private final int maxMessageChars;
    private final long batchDelayMs;
    private final ZoneId zone;

    public TelegramNotificationAdapter(
            @Value("${app.notify.telegram.botToken:}") String botToken,
            @Value("${app.notify.telegram.chatId:}") String chatId,
            @Value("${app.notify.telegram.apiBaseUrl:https://api.telegram.org}") String apiBaseUrl,
            @Value("${app.notify.telegram.connectTimeoutMs:10000}") int connectTimeoutMs,
            @Value("${app.notify.telegram.readTimeoutMs:20000}") int readTimeoutMs,
            @Value("${app.notify.telegram.maxMessageChars:4000}") int maxMessageChars,
            @Value("${app.notify.telegram.batchDelayMs:500}") long batchDelayMs,
            @Value("${app.notify.telegram.zone:Asia/Tehran}") String zone
    ) {
        this.botToken = botToken;
        this.chatId = chatId;
        this.apiBaseUrl = apiBaseUrl;
        this.connectTimeoutMs = connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs;
        this.maxMessageChars = (maxMessageChars <= 0 || maxMessageChars > 4096)
                ? MessageChunker.TELEGRAM_MAX_CHARS : maxMessageChars;
        this.batchDelayMs = Math.max(0, batchDelayMs);
        this.zone = ZoneId.of(zone);
    }

    @Override
    public void notifyChanges(ChangeReport report) {
        if (report == null || report.isEmpty()) {
            log.debug("[Telegram] Relatório vazio. Nada a enviar.");
            return;
        }
        if (isConfigMissing()) return;

        String range = timeRangeMessage(report.from(), report.to(), zone);
        boolean rangeOk = send(range, "MarkdownV2");
        sleep(batchDelayMs);

        int total = 0;
        int success = 0;
        for (String block : report.blocks()) {
            List<String> chunks = MessageChunker.split(escapeHtml(block), maxMessageChars);
            for (String chunk : chunks) {
                total++;
                if (send(chunk, "HTML")) success++;
                sleep(batchDelayMs);
            }
        }
        log.info("[Telegram] Envio concluído. faixa={} blocos={} chunksOk={}/{}",
                rangeOk ? "ok" : "falhou", report.blocks().size(), success, total);
    }

    static String timeRangeMessage(Instant from, Instant to, ZoneId zone) {
        return "```Time [" + formatTime(from, zone) + "] ➡️ [" + formatTime(to, zone) + "] ```";
    }

    static String formatTime(Instant instant, ZoneId zone) {
        return instant == null ? UNKNOWN_TIME : TIME_FORMAT.format(instant.atZone(zone));
    }

    static String escapeHtml(String s) {
        if (s == null) return "";
        return s.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }

    private boolean send(String text, String parseMode) {
        String endpoint = apiBaseUrl + "/bot" + botToken + "/sendMessage";
        byte[] bodyBytes = ("chat_id=" + urlEnc(chatId)
                + "&text=" + urlEnc(text)
                + "&parse_mode=" + parseMode
                + "&disable_web_page_preview=true").getBytes(StandardCharsets.UTF_8);

        HttpURLConnection con = null;
        try {
            URL url = new URL(endpoint);
            con = post(url, bodyBytes);
            int code = con.getResponseCode();

            int attempts = 0;
            while (code == 429 && attempts < 3) {
                attempts++;
                long retryMs = parseRetryAfterMs(con.getHeaderField("Retry-After"));
                log.warn("[Telegram] 429 Too Many Requests (tentativa {}). Aguardando {} ms.", attempts, retryMs);
                sleep(retryMs > 0 ? retryMs : 1000);
                con.disconnect();
                con = post(url, bodyBytes);
                code = con.getResponseCode();
            }

            if (code < 200 || code >= 300) {
                String err = readAll(con.getErrorStream());
                log.error("[Telegram] HTTP {} ao enviar mensagem. parseMode={} bytes={} err='{}'",
                        code, parseMode, bodyBytes.length, truncate(err));
                return false;
            }

            String resp = readAll(con.getInputStream());
            log.debug("[Telegram] Envio OK. parseMode={} bytes={} respLen={}", parseMode, bodyBytes.length, resp.length());
            return true;

        } catch (IOException e) {
            log.error("[Telegram] Falha no envio. parseMode={} bytes={} cause={}",
                    parseMode, bodyBytes.length, e.getMessage(), e);
            return false;
        } finally {
            if (con != null) con.disconnect();
        }
    }

    private HttpURLConnection post(URL url, byte[] bodyBytes) throws IOException {
        HttpURLConnection con = (HttpURLConnection) url.openConnection();
        con.setDoOutput(true);
        con.setRequestMethod("POST");
        con.setConnectTimeout(connectTimeoutMs);
        con.setReadTimeout(readTimeoutMs);
        con.setRequestProperty("Content-Type", "application/x-www-form-urlencoded; charset=UTF-8");
        try (OutputStream os = con.getOutputStream()) {
            os.write(bodyBytes);
        }
        return con;
    }

    private boolean isConfigMissing() {
        if (botToken == null || botToken.isBlank()) {
            log.warn("[Telegram] Bot token não configurado (TELEGRAM_TOKEN). Ignorando notificação.");
            return true;
        }
        if (chatId == null || chatId.isBlank()) {
            log.warn("[Telegram] Chat ID não configurado (TELEGRAM_CHAT_ID). Ignorando notificação.");
            return true;
        }
        return false;
    }

    static long parseRetryAfterMs(String header) {
        if (header == null || header.isBlank()) return 0;
        try {
            return (long) (Double.parseDouble(header.trim()) * 1000);
        } catch (NumberFormatException e) {
            log.debug("[Telegram] Retry-After inválido: '{}'", header);
            return 0;
        }
    }

    private static String urlEnc(String s) {
        return URLEncoder.encode(s == null ? "" : s, StandardCharsets.UTF_8);
    }

    private static String readAll(InputStream is) throws IOException {
        if (is == null) return "";
        try (is) {
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static void sleep(long ms) {
        if (ms <= 0) return;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    private static String truncate(String s) {
        if (s == null) return "";
        return s.length() <= 500 ? s : s.substring(0, 499) + "…";
    }
}
