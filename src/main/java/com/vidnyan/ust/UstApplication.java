package com.vidnyan.ust;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * UST - Universal Syntax Tree engine
 *
 * Parses Python, JavaScript and Java source into one language-neutral tree.
 */
@SpringBootApplication
public class UstApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(UstApplication.class, args)));
    }
}
