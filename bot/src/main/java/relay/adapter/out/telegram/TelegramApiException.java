package relay.adapter.out.telegram;

/**
 * Thrown when the Bot API rejects a call or answers with an unexpected response.
 *
 * <p>The message names the API method and error only, never the request URL or payload.
 * Transport failures are reported by exception type alone, since their messages carry
 * the request path and with it the bot token.
 */
public class TelegramApiException extends RuntimeException {

    private final String method;
    private final int errorCode;

    public TelegramApiException(String method, int errorCode, String description) {
        super("Telegram API call " + method + " failed with code " + errorCode
                + (description != null ? ": " + description : ""));
        this.method = method;
        this.errorCode = errorCode;
    }

    /**
     * Wrap a transport-level failure (timeout, connection refused, TLS error).
     *
     * <p>The cause is neither chained nor quoted.
     *
     * @param method  the API method being called
     * @param failure the transport failure
     * @return exception with error code 0
     */
    public static TelegramApiException transportFailure(String method, Throwable failure) {
        return new TelegramApiException(method, 0, "transport failure (" + failure.getClass().getSimpleName() + ")");
    }

    public String getMethod() {
        return method;
    }

    public int getErrorCode() {
        return errorCode;
    }
}
