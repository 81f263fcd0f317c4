package com.example.rental;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the rental order lifecycle service.
 */
@SpringBootApplication
public class RentalOrderApplication {

    public static void main(String[] args) {
        SpringApplication.run(RentalOrderApplication.class, args);
    }
}
