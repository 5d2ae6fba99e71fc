package io.github.drompincen.bugtrackr.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.bugtrackr")
public class BugTrackrApplication {

    public static void main(String[] args) {
        SpringApplication.run(BugTrackrApplication.class, args);
    }
}
