package com.taskhub.api.api.controller;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.Matchers.notNullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(properties = {
        "spring.datasource.url=jdbc:h2:mem:taskhub-ratelimit;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1",
        "taskhub.rate-limit.auth.limit=3",
        "taskhub.rate-limit.auth.window=1h",
        "taskhub.rate-limit.api.limit=4",
        "taskhub.rate-limit.api.window=1h"
})
@DisplayName("Rate limiting")
class RateLimitIntegrationTest extends ApiIntegrationSupport {

    private static final AtomicInteger NEXT_HOST = new AtomicInteger(1);

    // Every setup call comes from a fresh address so it never spends the budget under test
    @Override
    protected String clientAddress() {
        return "198.51.100." + NEXT_HOST.getAndIncrement();
    }

    @Test
    @DisplayName("login attempts past the auth limit get 429 with Retry-After")
    void authGroupLimit() throws Exception {
        String email = "nobody-" + UUID.randomUUID() + "@example.com";
        for (int i = 0; i < 3; i++) {
            mockMvc.perform(post("/auth/login")
                            .with(fromAddress("192.0.2.10"))
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json("email", email, "password", "wrong-password")))
                    .andExpect(status().isUnauthorized());
        }

        mockMvc.perform(post("/auth/login")
                        .with(fromAddress("192.0.2.10"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json("email", email, "password", "wrong-password")))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().exists("Retry-After"))
                .andExpect(header().string("X-RateLimit-Remaining", "0"))
                .andExpect(jsonPath("$.error").value("RATE_LIMIT_EXCEEDED"))
                .andExpect(jsonPath("$.retry_after").value(notNullValue()));
    }

    @Test
    @DisplayName("each user has their own api budget")
    void apiGroupLimitPerUser() throws Exception {
        Session first = registerAndLogin("quinn");
        Session second = registerAndLogin("ruth");

        for (int i = 0; i < 4; i++) {
            mockMvc.perform(get("/user").header("Authorization", first.bearer()))
                    .andExpect(status().isOk())
                    .andExpect(header().string("X-RateLimit-Remaining", String.valueOf(3 - i)));
        }

        mockMvc.perform(get("/user").header("Authorization", first.bearer()))
                .andExpect(status().isTooManyRequests());

        mockMvc.perform(get("/user").header("Authorization", second.bearer()))
                .andExpect(status().isOk());
    }
}
