package com.proofmend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProofMendApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(ProofMendApplication.class, args)));
    }
}
