package com.skillsarena.platform;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SkillsArenaApplication {
    public static void main(String[] args) {
        SpringApplication.run(SkillsArenaApplication.class, args);
    }
}
