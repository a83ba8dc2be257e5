package microservices.taskmanager.timeout.repository;

import java.time.Instant;
import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import microservices.taskmanager.timeout.entity.NotificationTimeout;

@Repository
public interface NotificationTimeoutRepository extends MongoRepository<NotificationTimeout, String> {

    List<NotificationTimeout> findByNextLessThanEqual(Instant now);

}
