package com.namingtool;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NamingToolApplication {

    public static void main(String[] args) {
        SpringApplication.run(NamingToolApplication.class, args);
    }
}
