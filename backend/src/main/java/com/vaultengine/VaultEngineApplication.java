package com.vaultengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VaultEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(VaultEngineApplication.class, args);
    }
}
