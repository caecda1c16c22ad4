package com.loyaltycard.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loyaltycard.common.exception.ErrorKind;
import com.loyaltycard.security.BearerTokenAuthenticationFilter;
import com.loyaltycard.security.IdentityResolver;
import com.loyaltycard.security.JsonErrorWriter;
import com.loyaltycard.security.PublicEndpoints;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Security configuration for bearer token authentication.
 *
 * Stateless: every protected request must carry its own token.
 */
@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    private final IdentityResolver identityResolver;
    private final ObjectMapper objectMapper;

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        JsonErrorWriter errorWriter = new JsonErrorWriter(objectMapper);

        return http
            .csrf(AbstractHttpConfigurer::disable)
            .httpBasic(AbstractHttpConfigurer::disable)
            .formLogin(AbstractHttpConfigurer::disable)
            .logout(AbstractHttpConfigurer::disable)
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(requests -> requests
                .requestMatchers(HttpMethod.POST, PublicEndpoints.AUTH_PATHS).permitAll()
                .requestMatchers(PublicEndpoints.DOC_PATHS).permitAll()
                .anyRequest().authenticated()
            )
            .exceptionHandling(exceptions -> exceptions
                .authenticationEntryPoint((request, response, ex) ->
                    errorWriter.write(response, ErrorKind.UNAUTHENTICATED, "Not authenticated"))
            )
            .addFilterBefore(new BearerTokenAuthenticationFilter(identityResolver, errorWriter),
                UsernamePasswordAuthenticationFilter.class)
            .build();
    }
}
