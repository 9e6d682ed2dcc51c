package com.firesql;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the FireSQL datasource.
 *
 * Serves SQL-style queries from a dashboard against a Firestore document store
 * and answers with typed, columnar frames.
 */
@SpringBootApplication
public class FireSqlApplication {

    /**
     * Main entry point.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(FireSqlApplication.class, args);
    }
}
