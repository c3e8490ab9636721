package com.vidnyan.bpml;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * BPML compiler core: semantic validation and process analysis of parsed models.
 */
@SpringBootApplication
public class BpmlApplication {

    public static void main(String[] args) {
        SpringApplication.run(BpmlApplication.class, args);
    }
}
