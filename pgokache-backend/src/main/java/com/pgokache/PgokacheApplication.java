package com.pgokache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PgokacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(PgokacheApplication.class, args);
    }
}
