package com.github.dimitryivaniuta.temporalcache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TemporalCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(TemporalCacheApplication.class, args);
    }
}
