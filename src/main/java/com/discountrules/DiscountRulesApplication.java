package com.discountrules;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for Discount Rules.
 *
 * Hosts discount requirement rules that decide whether a discount applies to a
 * customer's cart, together with the admin endpoints used to configure them.
 */
@SpringBootApplication
public class DiscountRulesApplication {

    public static void main(String[] args) {
        SpringApplication.run(DiscountRulesApplication.class, args);
    }
}
