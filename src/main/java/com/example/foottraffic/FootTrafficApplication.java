package com.example.foottraffic;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FootTrafficApplication {

    public static void main(String[] args) {
        SpringApplication.run(FootTrafficApplication.class, args);
    }
}
