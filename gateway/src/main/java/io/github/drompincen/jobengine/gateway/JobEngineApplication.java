package io.github.drompincen.jobengine.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.jobengine")
@EnableMongoRepositories(basePackages = "io.github.drompincen.jobengine.persistence.repository")
@EnableScheduling
public class JobEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(JobEngineApplication.class, args);
    }
}
