package io.github.drompincen.fixflow.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.fixflow")
@EnableMongoRepositories(basePackages = "io.github.drompincen.fixflow.persistence.repository")
public class FixFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(FixFlowApplication.class, args);
    }
}
