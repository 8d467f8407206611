package com.autonomous.cos;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChiefOfStaffApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChiefOfStaffApplication.class, args);
    }
}
