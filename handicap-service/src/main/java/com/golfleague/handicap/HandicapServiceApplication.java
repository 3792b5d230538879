package com.golfleague.handicap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HandicapServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(HandicapServiceApplication.class, args);
    }
}
