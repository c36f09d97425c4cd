package relay.adapter.out.telegram;

import java.time.Duration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import relay.config.TelegramConfig;

/**
 * Minimal Telegram Bot API client over the Vert.x web client.
 *
 * <h2>Request Format</h2>
 * <pre>{@code
 * POST {api-url}/bot{token}/{method}
 * Content-Type: application/json
 * }</pre>
 *
 * <h2>Response Format</h2>
 * <pre>{@code
 * { "ok": true, "result": ... }
 * { "ok": false, "error_code": 403, "description": "..." }
 * }</pre>
 *
 * <p>The request URL embeds the bot token and is never logged.
 */
@ApplicationScoped
public class TelegramBotClient {

    private static final Logger LOG = Logger.getLogger(TelegramBotClient.class);

    private final WebClient webClient;
    private final TelegramConfig config;

    @Inject
    public TelegramBotClient(Vertx vertx, TelegramConfig config) {
        this(WebClient.create(vertx), config);
    }

    TelegramBotClient(WebClient webClient, TelegramConfig config) {
        this.webClient = webClient;
        this.config = config;
    }

    /**
     * Fetch the bot's own user record.
     *
     * @return Uni with the {@code User} object
     */
    public Uni<JsonObject> getMe() {
        return call("getMe", new JsonObject(), config.requestTimeout()).map(result -> (JsonObject) result);
    }

    /**
     * Remove any webhook so long polling can be used.
     *
     * @param dropPendingUpdates whether queued updates are discarded
     * @return Uni completing when the webhook is removed
     */
    public Uni<Void> deleteWebhook(boolean dropPendingUpdates) {
        return call(
                        "deleteWebhook",
                        new JsonObject().put("drop_pending_updates", dropPendingUpdates),
                        config.requestTimeout())
                .replaceWithVoid();
    }

    /**
     * Long-poll for new message updates.
     *
     * @param offset identifier of the first update to return
     * @return Uni with the array of {@code Update} objects
     */
    public Uni<JsonArray> getUpdates(long offset) {
        final var body = new JsonObject()
                .put("offset", offset)
                .put("timeout", config.pollTimeout().toSeconds())
                .put("allowed_updates", new JsonArray().add("message"));
        return call("getUpdates", body, config.pollTimeout().plus(config.requestTimeout()))
                .map(result -> (JsonArray) result);
    }

    /**
     * Look up a user's membership in a chat.
     *
     * @param chatId the chat identifier
     * @param userId the user identifier
     * @return Uni with the {@code ChatMember} object
     */
    public Uni<JsonObject> getChatMember(String chatId, String userId) {
        final var body = new JsonObject().put("chat_id", chatIdValue(chatId)).put("user_id", chatIdValue(userId));
        return call("getChatMember", body, config.requestTimeout()).map(result -> (JsonObject) result);
    }

    /**
     * Send a plain-text message.
     *
     * @param chatId the target chat
     * @param text   message text
     * @return Uni completing when the message was accepted
     */
    public Uni<Void> sendMessage(String chatId, String text) {
        final var body = new JsonObject().put("chat_id", chatIdValue(chatId)).put("text", text);
        return call("sendMessage", body, config.requestTimeout()).replaceWithVoid();
    }

    private Uni<Object> call(String method, JsonObject body, Duration timeout) {
        final var token = config.token()
                .filter(value -> !value.isBlank())
                .orElseThrow(() -> new IllegalStateException("Telegram bot token not configured"));
        final var url = config.apiUrl() + "/bot" + token + "/" + method;

        return webClient
                .postAbs(url)
                .timeout(timeout.toMillis())
                .putHeader("Content-Type", "application/json")
                .putHeader("Accept", "application/json")
                .sendJsonObject(body)
                .onFailure()
                .transform(failure -> TelegramApiException.transportFailure(method, failure))
                .map(response -> unwrap(method, response));
    }

    private Object unwrap(String method, HttpResponse<Buffer> response) {
        final JsonObject payload;
        try {
            payload = response.bodyAsJsonObject();
        } catch (RuntimeException e) {
            throw new TelegramApiException(method, response.statusCode(), "response is not JSON");
        }

        if (response.statusCode() != 200 || payload == null || !payload.getBoolean("ok", false)) {
            final var errorCode = payload != null ? payload.getInteger("error_code", response.statusCode()) : response.statusCode();
            final var description = payload != null ? payload.getString("description") : null;
            LOG.debugf("Telegram API %s returned status=%d error_code=%d", method, response.statusCode(), errorCode);
            throw new TelegramApiException(method, errorCode, description);
        }
        return payload.getValue("result");
    }

    static Object chatIdValue(String id) {
        try {
            return Long.parseLong(id);
        } catch (NumberFormatException e) {
            // Public chats may be addressed by @username
            return id;
        }
    }
}
