package com.flagship.bill_settlement;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Bill settlement service.
 *
 * Splits a structured receipt across participants and returns a settlement
 * that reconciles exactly to the receipt total, with a reasoning trace.
 */
@SpringBootApplication
public class BillSettlementApplication {

    public static void main(String[] args) {
        SpringApplication.run(BillSettlementApplication.class, args);
    }
}
