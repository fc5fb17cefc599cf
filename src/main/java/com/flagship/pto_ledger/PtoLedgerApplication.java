package com.flagship.pto_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * PTO ledger service: policy versions, accruals, time-off requests and year-end processing
 * over an append-only minute ledger.
 */
@SpringBootApplication
@EnableScheduling
public class PtoLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PtoLedgerApplication.class, args);
    }
}
