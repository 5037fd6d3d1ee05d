package com.vidnyan.conclint;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * conclint - structured-concurrency linter for coroutine syntax trees.
 */
@SpringBootApplication
public class ConclintApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConclintApplication.class, args);
    }
}
