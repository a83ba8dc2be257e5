package microservices.taskmanager.timeout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TaskTimeoutServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskTimeoutServiceApplication.class, args);
    }

}
