package microservices.taskmanager.timeout.entity;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Audit of sent timeout notifications. Maps to the notification_timeouts
 * collection. A row whose next is set also schedules one timeout reminder;
 * once handled the row keeps its history and a new row carries the next one.
 */
@Document(collection = "notification_timeouts")
@Data
public class NotificationTimeout {

	@Id
	private String id;

	private String taskId;

	private Long usersId;

	private String description;

	@Indexed
	private Instant next;

	private int restMax;

	private int repeatCount;

	private boolean read;

	private Instant createdAt;

}
