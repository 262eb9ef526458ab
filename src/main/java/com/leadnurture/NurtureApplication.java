package com.leadnurture;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class NurtureApplication {

    public static void main(String[] args) {
        SpringApplication.run(NurtureApplication.class, args);
    }
}
