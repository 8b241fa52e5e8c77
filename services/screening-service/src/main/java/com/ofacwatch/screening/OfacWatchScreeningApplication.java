package com.ofacwatch.screening;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class OfacWatchScreeningApplication {

    public static void main(String[] args) {
        SpringApplication.run(OfacWatchScreeningApplication.class, args);
    }
}
