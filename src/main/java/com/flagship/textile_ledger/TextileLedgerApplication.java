package com.flagship.textile_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TextileLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TextileLedgerApplication.class, args);
    }
}
