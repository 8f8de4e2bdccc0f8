package org.example.organizer_bot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class OrganizerBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrganizerBotApplication.class, args);
    }
}
