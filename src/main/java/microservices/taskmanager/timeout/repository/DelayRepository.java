package microservices.taskmanager.timeout.repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import microservices.taskmanager.timeout.entity.Delay;

@Repository
public interface DelayRepository extends MongoRepository<Delay, String> {

    boolean existsByTaskIdAndRestMaxGreaterThan(String taskId, int restMax);

    Optional<Delay> findByTaskIdAndUserId(String taskId, Long userId);

    List<Delay> findByRestMaxGreaterThanAndNextAlarmAtLessThanEqual(int restMax, Instant now);

}
