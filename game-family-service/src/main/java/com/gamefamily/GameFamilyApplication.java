package com.gamefamily;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GameFamilyApplication {

    public static void main(String[] args) {
        SpringApplication.run(GameFamilyApplication.class, args);
    }
}
