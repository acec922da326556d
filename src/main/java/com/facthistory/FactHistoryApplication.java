package com.facthistory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FactHistoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(FactHistoryApplication.class, args);
    }
}
