package com.wheelskills.progress;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WheelSkillsProgressApplication {
    public static void main(String[] args) {
        SpringApplication.run(WheelSkillsProgressApplication.class, args);
    }
}
