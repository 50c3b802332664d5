package com.stagecraft.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StagecraftApplication {

    public static void main(String[] args) {
        SpringApplication.run(StagecraftApplication.class, args);
    }
}
