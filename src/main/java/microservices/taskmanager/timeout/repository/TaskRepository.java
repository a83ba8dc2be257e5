package microservices.taskmanager.timeout.repository;

import java.util.Collection;
import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import microservices.taskmanager.timeout.entity.Task;

@Repository
public interface TaskRepository extends MongoRepository<Task, String> {

    List<Task> findByStatusTrueAndTimeClotureNotNullAndTimeOutNotNull();

    List<Task> findByStatusTrueAndAlarmNotNullAndTimeClotureNotNullAndStepIn(Collection<String> steps);

}
