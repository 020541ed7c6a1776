package uk.gegc.planconfigurator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PlanConfiguratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlanConfiguratorApplication.class, args);
    }
}
