package com.physio.search;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ExerciseSearchServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(ExerciseSearchServiceApplication.class, args);
    }
}
