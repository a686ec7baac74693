package com.taskhub.api.config;

import com.taskhub.api.domain.ratelimit.FixedWindowRateLimiter;
import com.taskhub.api.domain.service.AccessTokenService;
import com.taskhub.api.filter.AccessTokenAuthenticationFilter;
import com.taskhub.api.filter.RateLimitFilter;
import com.taskhub.api.filter.RestAuthenticationEntryPoint;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.servlet.HandlerExceptionResolver;

import java.security.SecureRandom;

@Configuration
@EnableWebSecurity
public class SecurityConfig {

    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }

    @Bean
    public PasswordEncoder passwordEncoder(TaskHubProperties properties, SecureRandom secureRandom) {
        return new BCryptPasswordEncoder(properties.getAuth().getBcryptCost(), secureRandom);
    }

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http,
                                           AccessTokenService accessTokenService,
                                           FixedWindowRateLimiter rateLimiter,
                                           TaskHubProperties properties,
                                           @Qualifier("handlerExceptionResolver")
                                           HandlerExceptionResolver exceptionResolver) throws Exception {
        // Filters are built here, not declared as beans, so Boot does not also register them on the servlet chain
        AccessTokenAuthenticationFilter tokenFilter = new AccessTokenAuthenticationFilter(accessTokenService);
        RateLimitFilter rateLimitFilter = new RateLimitFilter(rateLimiter, properties.getRateLimit(), exceptionResolver);

        http
            // Disable CSRF for stateless APIs
            .csrf(AbstractHttpConfigurer::disable)
            .httpBasic(AbstractHttpConfigurer::disable)
            .formLogin(AbstractHttpConfigurer::disable)
            .logout(AbstractHttpConfigurer::disable)

            // Stateless session management
            .sessionManagement(session -> session
                    .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
            )

            .exceptionHandling(exceptions -> exceptions
                    .authenticationEntryPoint(new RestAuthenticationEntryPoint(exceptionResolver))
            )

            // Principal first, then rate limiting, then authorization
            .addFilterBefore(tokenFilter, UsernamePasswordAuthenticationFilter.class)
            .addFilterAfter(rateLimitFilter, AccessTokenAuthenticationFilter.class)

            // Authorization Rules
            .authorizeHttpRequests(auth -> auth
                // Public endpoints - Authentication
                .requestMatchers(HttpMethod.POST, "/auth/register", "/auth/login").permitAll()

                // API documentation and error dispatch
                .requestMatchers("/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html", "/error").permitAll()

                // All other requests require authentication
                .anyRequest().authenticated()
            );

        return http.build();
    }
}
