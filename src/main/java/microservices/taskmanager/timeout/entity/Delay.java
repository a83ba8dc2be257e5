package microservices.taskmanager.timeout.entity;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Per task and user rest allowance. Maps to the delays collection. A row with
 * restMax greater than zero is an active delay for its task.
 */
@Document(collection = "delays")
@CompoundIndex(def = "{'taskId': 1, 'userId': 1}", unique = true)
@Data
public class Delay {

	@Id
	private String id;

	private String taskId;

	private Long userId;

	private String restTime;

	private int restMax;

	@Indexed
	private Instant nextAlarmAt;

	private int alarmCount;

	private Instant lastAlarmAt;

	private Instant updatedAt;

}
