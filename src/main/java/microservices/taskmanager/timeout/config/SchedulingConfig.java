package microservices.taskmanager.timeout.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import com.mongodb.client.MongoClient;

import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.provider.mongo.MongoLockProvider;
import net.javacrumbs.shedlock.spring.annotation.EnableSchedulerLock;

/**
 * Cron scheduling plus the cluster-wide lock that keeps one instance per run.
 * Locks live in the shedLock collection of the service database.
 */
@Configuration
@EnableScheduling
@EnableSchedulerLock(defaultLockAtMostFor = "PT5M")
public class SchedulingConfig {

    @Bean
    public LockProvider lockProvider(MongoClient mongoClient,
                                     @Value("${spring.data.mongodb.database}") String database) {
        return new MongoLockProvider(mongoClient.getDatabase(database));
    }

}
