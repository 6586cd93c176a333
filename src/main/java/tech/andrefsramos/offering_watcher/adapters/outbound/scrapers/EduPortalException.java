package tech.andrefsramos.offering_watcher.adapters.outbound.scrapers;

/**
 * Falha fatal de sessão/transporte com o portal (status inesperado, redirecionamento para login,
 * login recusado). Aborta a passada de coleta inteira.
 */
public class EduPortalException extends RuntimeException {

    private final int statusCode;

    public EduPortalException(String message) {
        this(message, -1, null);
    }

    public EduPortalException(String message, int statusCode) {
        this(message, statusCode, null);
    }

    public EduPortalException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
