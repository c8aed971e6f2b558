package com.lendingvault.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class LendingVaultApplication {

    public static void main(String[] args) {
        SpringApplication.run(LendingVaultApplication.class, args);
    }
}
