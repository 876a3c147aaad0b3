package com.simtask;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SimtaskApplication {

    public static void main(String[] args) {
        SpringApplication.run(SimtaskApplication.class, args);
    }
}
