package microservices.taskmanager.timeout.repository;

import java.time.Instant;
import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import microservices.taskmanager.timeout.entity.AlarmNotification;

@Repository
public interface AlarmNotificationRepository extends MongoRepository<AlarmNotification, String> {

    List<AlarmNotification> findByNextLessThanEqual(Instant now);

    List<AlarmNotification> findByTaskIdAndNextNotNull(String taskId);

    boolean existsByTaskIdAndCreatedAtGreaterThanEqual(String taskId, Instant since);

}
