package com.taskhub.api.filter;

import com.taskhub.api.config.TaskHubProperties;
import com.taskhub.api.domain.exception.RateLimitExceededException;
import com.taskhub.api.domain.exception.RateLimiterUnavailableException;
import com.taskhub.api.domain.model.AuthenticatedUser;
import com.taskhub.api.domain.ratelimit.FixedWindowRateLimiter;
import com.taskhub.api.domain.ratelimit.RateLimitDecision;
import com.taskhub.api.domain.ratelimit.RateLimitGroup;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpMethod;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerExceptionResolver;

import java.io.IOException;

import static com.taskhub.api.domain.constants.AuthConstants.IP_KEY_PREFIX;
import static com.taskhub.api.domain.constants.AuthConstants.USER_KEY_PREFIX;

/**
 * Fixed-window rate limiting per route group and client.
 *
 * <ul>
 *   <li>{@code auth} group (register, login): keyed by client IP</li>
 *   <li>{@code api} group (everything else): keyed by user id when authenticated, else by IP</li>
 * </ul>
 *
 * Runs after the bearer token has been resolved and before any authorization decision, validation
 * or controller. A rejection goes through GlobalExceptionHandler as a 429 with Retry-After.
 *
 * Headers on every admitted response:
 *   X-RateLimit-Limit: 60
 *   X-RateLimit-Remaining: 42
 */
@Slf4j
public class RateLimitFilter extends OncePerRequestFilter {

    public static final String LIMIT_HEADER = "X-RateLimit-Limit";
    public static final String REMAINING_HEADER = "X-RateLimit-Remaining";

    private final FixedWindowRateLimiter rateLimiter;
    private final TaskHubProperties.RateLimit settings;
    private final HandlerExceptionResolver exceptionResolver;

    public RateLimitFilter(FixedWindowRateLimiter rateLimiter,
                           TaskHubProperties.RateLimit settings,
                           HandlerExceptionResolver exceptionResolver) {
        this.rateLimiter = rateLimiter;
        this.settings = settings;
        this.exceptionResolver = exceptionResolver;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !settings.isEnabled();
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        RateLimitGroup group = resolveGroup(request);
        TaskHubProperties.Window window = group.windowFrom(settings);
        String clientKey = resolveClientKey(request, group);

        RateLimitDecision decision;
        try {
            decision = rateLimiter.checkAndIncrement(group + ":" + clientKey, window.getLimit(), window.getWindow());
        } catch (DataAccessException e) {
            log.error("[RATE_LIMIT_STORE_ERROR] Counter store unavailable | group={} | failOpen={} | error={}",
                    group, settings.isFailOpen(), e.getMessage());
            if (settings.isFailOpen()) {
                filterChain.doFilter(request, response);
            } else {
                exceptionResolver.resolveException(request, response, null,
                        new RateLimiterUnavailableException("Rate limiter unavailable", e));
            }
            return;
        }

        response.setHeader(LIMIT_HEADER, String.valueOf(decision.limit()));
        response.setHeader(REMAINING_HEADER, String.valueOf(decision.remaining()));

        if (!decision.allowed()) {
            log.warn("[RATE_LIMIT_EXCEEDED] Request rejected | group={} | client={} | retryAfter={}s",
                    group, clientKey, decision.retryAfterSeconds());
            exceptionResolver.resolveException(request, response, null,
                    new RateLimitExceededException("Too Many Attempts.", decision.retryAfterSeconds(), decision.limit()));
            return;
        }

        filterChain.doFilter(request, response);
    }

    static RateLimitGroup resolveGroup(HttpServletRequest request) {
        if (HttpMethod.POST.matches(request.getMethod())) {
            String path = request.getRequestURI().substring(request.getContextPath().length());
            if ("/auth/register".equals(path) || "/auth/login".equals(path)) {
                return RateLimitGroup.AUTH;
            }
        }
        return RateLimitGroup.API;
    }

    private String resolveClientKey(HttpServletRequest request, RateLimitGroup group) {
        if (group == RateLimitGroup.API) {
            Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
            if (authentication != null && authentication.getPrincipal() instanceof AuthenticatedUser user) {
                return USER_KEY_PREFIX + user.id();
            }
        }
        return IP_KEY_PREFIX + resolveClientIp(request);
    }

    private String resolveClientIp(HttpServletRequest request) {
        if (settings.isTrustForwardedHeaders()) {
            String xForwardedFor = request.getHeader("X-Forwarded-For");
            if (xForwardedFor != null && !xForwardedFor.isEmpty()) {
                return xForwardedFor.split(",")[0].trim();
            }

            String xRealIp = request.getHeader("X-Real-IP");
            if (xRealIp != null && !xRealIp.isEmpty()) {
                return xRealIp;
            }
        }
        return request.getRemoteAddr() != null ? request.getRemoteAddr() : "unknown";
    }
}
