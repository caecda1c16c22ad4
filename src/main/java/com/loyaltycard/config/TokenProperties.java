package com.loyaltycard.config;

import com.loyaltycard.security.SigningAlgorithm;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Bearer token settings, bound once at startup from {@code loyalty-card.token.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "loyalty-card.token")
public class TokenProperties {

    /**
     * HMAC signing secret. Must be at least as long as the algorithm's key size.
     */
    @NotBlank
    private String secret;

    @NotNull
    private SigningAlgorithm algorithm = SigningAlgorithm.HS256;

    @NotNull
    private Duration ttl = Duration.ofMinutes(60);
}
