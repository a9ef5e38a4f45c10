package com.confer.mortgageServer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MortgageServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(MortgageServerApplication.class, args);
    }
}
