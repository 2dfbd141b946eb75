package com.multidb;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

/**
 * Each configured source gets its own data source, so the single auto-configured one is off.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class MultiDbApplication {

    public static void main(String[] args) {
        SpringApplication.run(MultiDbApplication.class, args);
    }
}
