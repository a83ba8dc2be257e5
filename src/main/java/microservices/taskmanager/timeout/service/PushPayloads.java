package microservices.taskmanager.timeout.service;

import java.util.LinkedHashMap;
import java.util.Map;

import microservices.taskmanager.timeout.entity.Task;
import microservices.taskmanager.timeout.entity.UserAccount;
import microservices.taskmanager.timeout.enums.NotificationType;
import microservices.taskmanager.timeout.notifier.PushMessage;

/**
 * Data keys every push from this service carries. Values are strings because
 * the transport only accepts string data.
 */
final class PushPayloads {

    static final String LAST_TIME_PREFIX = "LAST TIME: ";

    private PushPayloads() {
    }

    static Map<String, String> baseData(Task task, UserAccount user, String title, String body,
                                        NotificationType type, boolean lastTime) {
        Map<String, String> data = new LinkedHashMap<>();
        data.put("title", title);
        data.put("body", body);
        data.put("task_id", task.getId());
        data.put("task_name", nullToEmpty(task.getName()));
        data.put("task_step", nullToEmpty(task.getStep()));
        data.put("user_name", nullToEmpty(user.getUserName()));
        data.put("notification_type", type.getValue());
        data.put("is_last_time", String.valueOf(lastTime));
        return data;
    }

    static PushMessage message(UserAccount user, String title, String body, Map<String, String> data) {
        return PushMessage.builder()
                .token(user.getFcmToken())
                .title(title)
                .body(body)
                .data(data)
                .build();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

}
