package io.github.drompincen.habitnotifier.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.habitnotifier")
@EnableMongoRepositories(basePackages = "io.github.drompincen.habitnotifier.persistence.repository")
public class HabitNotifierApplication {

    public static void main(String[] args) {
        SpringApplication.run(HabitNotifierApplication.class, args);
    }
}
