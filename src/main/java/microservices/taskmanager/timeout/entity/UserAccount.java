package microservices.taskmanager.timeout.entity;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Read-only view of the users collection owned by the account service.
 */
@Document(collection = "users")
@Data
public class UserAccount {

	@Id
	private Long id;

	private String userName;

	private String email;

	private String fcmToken;

	public boolean hasPushToken() {
		return fcmToken != null && !fcmToken.isBlank();
	}

}
