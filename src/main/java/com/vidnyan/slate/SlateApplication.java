package com.vidnyan.slate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * SLATE - Structural Lint And Transform Engine
 *
 * Parses source files into syntax trees, runs the configured rules over them and optionally
 * applies the rules' fixes.
 */
@SpringBootApplication
public class SlateApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(SlateApplication.class, args)));
    }
}
