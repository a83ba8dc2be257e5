package microservices.taskmanager.timeout.entity;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One recipient's alarm series for a task. Maps to the alarm_notifications
 * collection.
 */
@Document(collection = "alarm_notifications")
@CompoundIndex(name = "task_created_idx", def = "{'taskId': 1, 'createdAt': 1}")
@Data
public class AlarmNotification {

	@Id
	private String id;

	private String taskId;

	private Long usersId;

	private String description;

	@Indexed
	private Instant next;

	private int restMax;// 0 means no limit

	private int notificationCount;

	private boolean read;

	private Instant createdAt;

}
