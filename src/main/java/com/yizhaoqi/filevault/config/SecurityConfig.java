package com.yizhaoqi.filevault.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

import java.nio.charset.StandardCharsets;


@Configuration
@EnableWebSecurity
public class SecurityConfig {


    private static final Logger logger = LoggerFactory.getLogger(SecurityConfig.class);

    private static final String UNAUTHORIZED_BODY = "{\"error\":\"Unauthorized\"}";

    @Autowired
    private SessionAuthenticationFilter sessionAuthenticationFilter;


    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        try {

            http.csrf(csrf -> csrf.disable())

                    .authorizeHttpRequests(authorize -> authorize

                            .requestMatchers(HttpMethod.GET, "/status", "/stats").permitAll()

                            .requestMatchers(HttpMethod.POST, "/users").permitAll()

                            .requestMatchers(HttpMethod.GET, "/connect").permitAll()

                            // Public files are readable without a session.
                            .requestMatchers(HttpMethod.GET, "/files/*/data").permitAll()

                            .requestMatchers("/error").permitAll()

                            .anyRequest().authenticated())


                    .sessionManagement(session -> session
                            .sessionCreationPolicy(SessionCreationPolicy.STATELESS))

                    .exceptionHandling(handling -> handling
                            .authenticationEntryPoint((request, response, authException) -> {
                                response.setStatus(HttpStatus.UNAUTHORIZED.value());
                                response.setContentType(MediaType.APPLICATION_JSON_VALUE);
                                response.setCharacterEncoding(StandardCharsets.UTF_8.name());
                                response.getWriter().write(UNAUTHORIZED_BODY);
                            }))

                    .addFilterBefore(sessionAuthenticationFilter, UsernamePasswordAuthenticationFilter.class);


            logger.info("Security configuration loaded successfully.");

            return http.build();
        } catch (Exception e) {

            logger.error("Failed to configure security filter chain", e);

            throw e;
        }
    }
}
