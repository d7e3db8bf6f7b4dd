package com.lendledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class LendLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LendLedgerApplication.class, args);
    }
}
