package relay.adapter.out.telegram;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import relay.core.model.command.ChatContext;

@DisplayName("TelegramChatGateway")
@ExtendWith(MockitoExtension.class)
class TelegramChatGatewayTest {

    private static final Duration AWAIT = Duration.ofSeconds(1);

    @Mock
    private TelegramBotClient client;

    private TelegramChatGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new TelegramChatGateway(client);
    }

    @Nested
    @DisplayName("isGroupAdmin()")
    class IsGroupAdminTests {

        @Test
        @DisplayName("should accept the group creator")
        void shouldAcceptCreator() {
            when(client.getChatMember("-100200", "42"))
                    .thenReturn(Uni.createFrom().item(new JsonObject().put("status", "creator")));

            assertTrue(gateway.isGroupAdmin("42", "-100200").await().atMost(AWAIT));
        }

        @Test
        @DisplayName("should accept an administrator")
        void shouldAcceptAdministrator() {
            when(client.getChatMember("-100200", "42"))
                    .thenReturn(Uni.createFrom().item(new JsonObject().put("status", "administrator")));

            assertTrue(gateway.isGroupAdmin("42", "-100200").await().atMost(AWAIT));
        }

        @Test
        @DisplayName("should reject ordinary and restricted members")
        void shouldRejectMembers() {
            when(client.getChatMember("-100200", "42"))
                    .thenReturn(Uni.createFrom().item(new JsonObject().put("status", "member")));
            when(client.getChatMember("-100200", "43"))
                    .thenReturn(Uni.createFrom().item(new JsonObject().put("status", "restricted")));

            assertFalse(gateway.isGroupAdmin("42", "-100200").await().atMost(AWAIT));
            assertFalse(gateway.isGroupAdmin("43", "-100200").await().atMost(AWAIT));
        }

        @Test
        @DisplayName("should propagate API failures")
        void shouldPropagateFailures() {
            when(client.getChatMember("-100200", "42"))
                    .thenReturn(Uni.createFrom().failure(new TelegramApiException("getChatMember", 400, "chat not found")));

            final var error = assertThrows(
                    TelegramApiException.class, () -> gateway.isGroupAdmin("42", "-100200").await().atMost(AWAIT));
            assertEquals(400, error.getErrorCode());
            assertEquals("getChatMember", error.getMethod());
        }
    }

    @Nested
    @DisplayName("Message delivery")
    class DeliveryTests {

        @Test
        @DisplayName("should deliver privately to the subject's own chat")
        void shouldDeliverToSubjectChat() {
            when(client.sendMessage("42", "payload")).thenReturn(Uni.createFrom().voidItem());

            gateway.deliverPrivate("42", "payload").await().atMost(AWAIT);

            verify(client).sendMessage("42", "payload");
        }

        @Test
        @DisplayName("should reply in the group for group contexts")
        void shouldReplyInGroup() {
            when(client.sendMessage("-100200", "hi")).thenReturn(Uni.createFrom().voidItem());

            gateway.replyInContext(new ChatContext.Group("-100200", "Team"), "hi").await().atMost(AWAIT);

            verify(client).sendMessage("-100200", "hi");
        }

        @Test
        @DisplayName("should reply in the private chat for private contexts")
        void shouldReplyInPrivateChat() {
            when(client.sendMessage("42", "hi")).thenReturn(Uni.createFrom().voidItem());

            gateway.replyInContext(new ChatContext.Private("42"), "hi").await().atMost(AWAIT);

            verify(client).sendMessage("42", "hi");
        }
    }
}
