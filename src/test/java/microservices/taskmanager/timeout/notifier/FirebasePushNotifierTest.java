package microservices.taskmanager.timeout.notifier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import com.google.firebase.messaging.FirebaseMessaging;
import com.google.firebase.messaging.Message;

class FirebasePushNotifierTest {

    private static final Instant T0 = Instant.parse("2026-03-02T08:00:00Z");

    @Test
    void isAvailable_WithoutCredentials_ShouldBeFalse() {
        Clock clock = mock(Clock.class);
        FirebasePushNotifier notifier = new FirebasePushNotifier("", "", clock);

        assertFalse(notifier.isAvailable());
        assertFalse(notifier.isAvailable());
        verifyNoInteractions(clock);
    }

    @Test
    void isAvailable_WithMissingCredentialsFile_ShouldBeFalse() {
        FirebasePushNotifier notifier = new FirebasePushNotifier("/nonexistent/service-account.json", "demo",
                Clock.fixed(T0, ZoneOffset.UTC));

        assertFalse(notifier.isAvailable());
    }

    @Test
    void isAvailable_AfterFailedInitialization_ShouldRetryOnceIntervalPassed() throws Exception {
        // Arrange
        Clock clock = mock(Clock.class);
        when(clock.instant()).thenReturn(
                T0,
                T0.plusSeconds(30),
                T0.plus(FirebasePushNotifier.RETRY_INTERVAL).plusSeconds(1));
        FirebaseMessaging client = mock(FirebaseMessaging.class);
        when(client.send(any(Message.class))).thenReturn("projects/demo/messages/1");
        AtomicInteger attempts = new AtomicInteger();
        FirebasePushNotifier notifier = new FirebasePushNotifier("/etc/task-timeout/service-account.json", "demo", clock) {
            @Override
            protected FirebaseMessaging connect() throws IOException {
                if (attempts.incrementAndGet() == 1) {
                    throw new IOException("Connection reset");
                }
                return client;
            }
        };

        // Act & Assert
        assertFalse(notifier.isAvailable());
        assertFalse(notifier.isAvailable());
        assertEquals(1, attempts.get());

        assertTrue(notifier.isAvailable());
        assertEquals(2, attempts.get());

        String messageId = notifier.send(PushMessage.builder()
                .token("token-7")
                .title("Task Start Time: Inventory")
                .body("body")
                .build());
        assertEquals("projects/demo/messages/1", messageId);
        assertTrue(notifier.isAvailable());
        assertEquals(2, attempts.get());
    }

    @Test
    void send_WhenUnavailable_ShouldThrowDeliveryException() {
        FirebasePushNotifier notifier = new FirebasePushNotifier("", "", mock(Clock.class));
        PushMessage message = PushMessage.builder()
                .token("token-7")
                .title("Task Start Time: Inventory")
                .body("body")
                .build();

        PushDeliveryException ex = assertThrows(PushDeliveryException.class, () -> notifier.send(message));
        assertEquals("Firebase messaging is not available", ex.getMessage());
    }

}
