package microservices.taskmanager.timeout.repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import microservices.taskmanager.timeout.entity.UserAccount;

@Repository
public interface UserAccountRepository extends MongoRepository<UserAccount, Long> {

    List<UserAccount> findByIdIn(Collection<Long> ids);

    Optional<UserAccount> findFirstByUserNameOrEmail(String userName, String email);

}
