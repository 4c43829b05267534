package de.jwiegmann.skiptrace;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SkipTraceApplication {

    public static void main(String[] args) {
        SpringApplication.run(SkipTraceApplication.class, args);
    }
}
