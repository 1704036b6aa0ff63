package com.tracura.plm;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PlmApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlmApplication.class, args);
    }
}
