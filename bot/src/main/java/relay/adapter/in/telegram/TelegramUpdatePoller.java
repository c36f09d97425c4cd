package relay.adapter.in.telegram;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import org.jboss.logging.Logger;

import relay.adapter.out.telegram.TelegramBotClient;
import relay.config.TelegramConfig;

/**
 * Long-polls the Telegram Bot API and hands each update to the router.
 *
 * <p>Each update is routed on its own subscription, so a slow admin check for one
 * user never delays another user's command.
 *
 * <h2>Failure Behavior</h2>
 * <ul>
 *   <li>Transport disabled or no token configured: the poller stays idle</li>
 *   <li>Malformed token: startup FAILS</li>
 *   <li>Poll errors: retried with exponential backoff (1s doubling, capped at 30s)</li>
 * </ul>
 */
@ApplicationScoped
public class TelegramUpdatePoller {

    private static final Logger LOG = Logger.getLogger(TelegramUpdatePoller.class);
    private static final Duration INITIAL_BACKOFF = Duration.ofSeconds(1);
    private static final Duration MAX_BACKOFF = Duration.ofSeconds(30);

    private final TelegramBotClient client;
    private final TelegramUpdateRouter router;
    private final TelegramConfig config;
    private final Vertx vertx;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong offset = new AtomicLong(0);
    private volatile Duration backoff = INITIAL_BACKOFF;

    @Inject
    public TelegramUpdatePoller(
            TelegramBotClient client, TelegramUpdateRouter router, TelegramConfig config, Vertx vertx) {
        this.client = client;
        this.router = router;
        this.config = config;
        this.vertx = vertx;
    }

    void onStart(@Observes StartupEvent event) {
        if (!config.enabled()) {
            LOG.info("Telegram transport is disabled");
            return;
        }

        final var token = config.token().filter(value -> !value.isBlank());
        if (token.isEmpty()) {
            LOG.warn("No Telegram bot token configured (set RELAY_TELEGRAM_TOKEN); transport stays idle");
            return;
        }
        if (!BotTokenValidator.isValid(token.get())) {
            LOG.error("Telegram bot token is malformed; expected <bot-id>:<secret>");
            throw new TransportStartupException("Configured Telegram bot token is malformed");
        }

        running.set(true);
        LOG.info("Privacy mode: RAM-only storage, entries expire automatically");

        client.deleteWebhook(config.dropPendingUpdates())
                .flatMap(ignored -> client.getMe())
                .subscribe()
                .with(
                        me -> {
                            router.setBotUsername(me.getString("username"));
                            LOG.infof("Polling Telegram updates as @%s", me.getString("username"));
                            poll();
                        },
                        failure -> {
                            LOG.warnf(
                                    "Could not identify bot (%s); polling without mention filtering",
                                    failure.getMessage());
                            poll();
                        });
    }

    void onStop(@Observes ShutdownEvent event) {
        if (running.compareAndSet(true, false)) {
            LOG.info("Telegram polling stopped; all registration data is discarded with the process");
        }
    }

    /**
     * Whether the poll loop is active.
     *
     * @return true while polling
     */
    public boolean isRunning() {
        return running.get();
    }

    private void poll() {
        if (!running.get()) {
            return;
        }

        client.getUpdates(offset.get())
                .subscribe()
                .with(
                        updates -> {
                            backoff = INITIAL_BACKOFF;
                            dispatch(updates);
                            poll();
                        },
                        failure -> {
                            final var delay = backoff;
                            backoff = delay.multipliedBy(2).compareTo(MAX_BACKOFF) > 0 ? MAX_BACKOFF : delay.multipliedBy(2);
                            LOG.warnf("Polling Telegram updates failed (%s); retrying in %s", failure.getMessage(), delay);
                            vertx.setTimer(delay.toMillis(), timerId -> poll());
                        });
    }

    private void dispatch(JsonArray updates) {
        if (updates == null) {
            return;
        }

        for (var i = 0; i < updates.size(); i++) {
            final JsonObject update = updates.getJsonObject(i);
            final var updateId = update.getLong("update_id", -1L);
            offset.accumulateAndGet(updateId + 1, Math::max);

            Uni.createFrom()
                    .deferred(() -> router.route(update))
                    .subscribe()
                    .with(
                            done -> LOG.tracef("Handled update %d", updateId),
                            failure -> LOG.warnf(
                                    "Failed to handle update %d: %s", updateId, failure.getClass().getSimpleName()));
        }
    }
}
