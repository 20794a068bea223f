package com.demo.policy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PolicyConsentApplication {

    public static void main(String[] args) {
        SpringApplication.run(PolicyConsentApplication.class, args);
    }
}
