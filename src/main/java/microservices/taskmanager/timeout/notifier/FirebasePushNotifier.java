package microservices.taskmanager.timeout.notifier;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.firebase.FirebaseApp;
import com.google.firebase.FirebaseOptions;
import com.google.firebase.messaging.FirebaseMessaging;
import com.google.firebase.messaging.FirebaseMessagingException;
import com.google.firebase.messaging.Message;
import com.google.firebase.messaging.Notification;

import lombok.extern.slf4j.Slf4j;

/**
 * Firebase Cloud Messaging transport. Initialized on first use from a service
 * account file. Without a configured file it stays unavailable; a failed
 * initialization is retried once {@link #RETRY_INTERVAL} has passed.
 */
@Component
@Slf4j
public class FirebasePushNotifier implements PushNotifier {

    static final Duration RETRY_INTERVAL = Duration.ofMinutes(1);

    private static final String APP_NAME = "task-timeout";

    private final String credentialsPath;
    private final String projectId;
    private final Clock clock;

    private volatile FirebaseMessaging messaging;
    private volatile boolean disabled;
    private Instant retryAt;

    public FirebasePushNotifier(@Value("${task-timeout.firebase.credentials-path:}") String credentialsPath,
                                @Value("${task-timeout.firebase.project-id:}") String projectId,
                                Clock clock) {
        this.credentialsPath = credentialsPath;
        this.projectId = projectId;
        this.clock = clock;
    }

    @Override
    public boolean isAvailable() {
        return getMessaging() != null;
    }

    @Override
    public String send(PushMessage message) throws PushDeliveryException {
        FirebaseMessaging client = getMessaging();
        if (client == null) {
            throw new PushDeliveryException("Firebase messaging is not available");
        }
        Message firebaseMessage = Message.builder()
                .setToken(message.getToken())
                .setNotification(Notification.builder()
                        .setTitle(message.getTitle())
                        .setBody(message.getBody())
                        .build())
                .putAllData(message.getData())
                .build();
        try {
            return client.send(firebaseMessage);
        } catch (FirebaseMessagingException e) {
            throw new PushDeliveryException("Firebase rejected message: " + e.getMessagingErrorCode(), e);
        }
    }

    private FirebaseMessaging getMessaging() {
        FirebaseMessaging client = messaging;
        if (client != null || disabled) {
            return client;
        }
        synchronized (this) {
            if (messaging != null || disabled) {
                return messaging;
            }
            if (credentialsPath == null || credentialsPath.isBlank()) {
                log.warn("Firebase configuration is missing, push notifications are disabled");
                disabled = true;
                return null;
            }
            Instant now = clock.instant();
            if (retryAt != null && now.isBefore(retryAt)) {
                return null;
            }
            try {
                messaging = connect();
                retryAt = null;
            } catch (IOException | RuntimeException e) {
                retryAt = now.plus(RETRY_INTERVAL);
                log.error("Firebase initialization failed, next attempt at {}: {}", retryAt, e.getMessage(), e);
            }
            return messaging;
        }
    }

    /**
     * Builds the messaging client. An app left behind by an earlier attempt
     * under the same name is reused.
     */
    protected FirebaseMessaging connect() throws IOException {
        FirebaseApp app = FirebaseApp.getApps().stream()
                .filter(existing -> APP_NAME.equals(existing.getName()))
                .findFirst()
                .orElse(null);
        if (app == null) {
            try (InputStream credentials = new FileInputStream(credentialsPath)) {
                FirebaseOptions.Builder options = FirebaseOptions.builder()
                        .setCredentials(GoogleCredentials.fromStream(credentials));
                if (projectId != null && !projectId.isBlank()) {
                    options.setProjectId(projectId);
                }
                app = FirebaseApp.initializeApp(options.build(), APP_NAME);
            }
        }
        log.info("Firebase messaging initialized for project {}", app.getOptions().getProjectId());
        return FirebaseMessaging.getInstance(app);
    }

}
