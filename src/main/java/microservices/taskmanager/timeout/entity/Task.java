package microservices.taskmanager.timeout.entity;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Entity representing a monitored task. Maps to the tasks collection.
 * Only the fields the timeout sweep reads or writes are mapped.
 */
@Document(collection = "tasks")
@Data
public class Task {

	@Id
	private String id;

	private String name;

	private String step;// pending, in_progress, ...

	@Indexed
	private boolean status;

	private LocalDate periodStart;

	private LocalDate periodEnd;

	private String periodType;// "daily" or "periodic (daily)"

	private String timeCloture;// HH:mm[:ss]

	private String timeOut;// HH:mm[:ss]

	private String restTime;// HH:mm[:ss] duration of one rest

	private Integer restMax;

	private String users;// JSON array of user ids, e.g. "[2,3]"

	private Long createdBy;

	private String controller;// user id, user name or email

	private String alarm;// JSON: {"days":1,"hours":2} offset, or {"all":"07:30","monday":"08:00"} times

	private Instant createdAt;

	private Instant timeoutNotifiedAt;

	private Instant timeoutNotifiedDeadline;

}
