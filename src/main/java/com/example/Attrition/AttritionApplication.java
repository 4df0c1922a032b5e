package com.example.Attrition;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AttritionApplication {

    public static void main(String[] args) {
        SpringApplication.run(AttritionApplication.class, args);
    }
}
