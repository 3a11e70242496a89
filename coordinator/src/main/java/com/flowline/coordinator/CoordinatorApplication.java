package com.flowline.coordinator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Build coordinator: event store, notification bus, build lifecycle,
 * pipeline config store and resource ledger, all backed by one PostgreSQL
 * database. Several instances may run against the same database.
 *
 * To run:
 *   SPRING_DATASOURCE_URL=jdbc:postgresql://localhost:5432/flowline mvn -pl coordinator spring-boot:run
 */
@SpringBootApplication
public class CoordinatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoordinatorApplication.class, args);
    }
}
