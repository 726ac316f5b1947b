package com.priceintel.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PriceIntelBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(PriceIntelBackendApplication.class, args);
    }
}
