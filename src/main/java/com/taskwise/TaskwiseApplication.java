package com.taskwise;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication
public class TaskwiseApplication {

    public static void main(String[] args) {
        // No web server; callers embed TaskArchitectureService.
        new SpringApplicationBuilder(TaskwiseApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off"
                )
                .run(args);
    }
}
