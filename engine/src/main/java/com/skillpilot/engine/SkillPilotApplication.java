package com.skillpilot.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SkillPilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(SkillPilotApplication.class, args);
    }
}
