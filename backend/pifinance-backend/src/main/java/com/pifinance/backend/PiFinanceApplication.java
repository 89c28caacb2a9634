package com.pifinance.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PiFinanceApplication {

    public static void main(String[] args) {
        SpringApplication.run(PiFinanceApplication.class, args);
    }
}
