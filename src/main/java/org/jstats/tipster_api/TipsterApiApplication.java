package org.jstats.tipster_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TipsterApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(TipsterApiApplication.class, args);
    }
}
