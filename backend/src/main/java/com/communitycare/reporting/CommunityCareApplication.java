package com.communitycare.reporting;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CommunityCareApplication {
    public static void main(String[] args) {
        SpringApplication.run(CommunityCareApplication.class, args);
    }
}
