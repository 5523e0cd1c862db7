package com.fintech.metals;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Metal price engine: polls metals quote feeds during exchange hours and serves
 * session-bounded aggregates.
 */
@SpringBootApplication
public class MetalPriceEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(MetalPriceEngineApplication.class, args);
    }
}
