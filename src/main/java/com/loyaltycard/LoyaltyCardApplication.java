package com.loyaltycard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Loyalty Card Engine.
 *
 * Vendors register, enroll their customers and track visits on punch cards
 * until a reward threshold is reached and the reward is redeemed. Every
 * vendor only ever sees its own customers and cards.
 */
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
@ConfigurationPropertiesScan
public class LoyaltyCardApplication {

    public static void main(String[] args) {
        SpringApplication.run(LoyaltyCardApplication.class, args);
    }
}
