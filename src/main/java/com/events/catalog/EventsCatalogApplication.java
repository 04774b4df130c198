package com.events.catalog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EventsCatalogApplication {

    public static void main(String[] args) {
        SpringApplication.run(EventsCatalogApplication.class, args);
    }
}
