package com.vidnyan.smelldsl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * SmellDSL - code smell detection rules interpreter.
 *
 * Serves the detection pipeline over HTTP and, when configured with file
 * paths, runs it once from the command line.
 */
@SpringBootApplication
public class SmellDslApplication {

    public static void main(String[] args) {
        SpringApplication.run(SmellDslApplication.class, args);
    }
}
