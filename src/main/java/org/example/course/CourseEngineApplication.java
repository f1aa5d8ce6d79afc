package org.example.course;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CourseEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(CourseEngineApplication.class, args);
    }
}
