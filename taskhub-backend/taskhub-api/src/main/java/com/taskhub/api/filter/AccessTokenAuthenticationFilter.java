package com.taskhub.api.filter;

import com.taskhub.api.domain.model.AuthenticatedUser;
import com.taskhub.api.domain.service.AccessTokenService;
import com.taskhub.api.domain.utils.BearerTokens;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;

/**
 * ------------------------------------------------------------------------------------------------------
 * Bearer Token Authentication Filter
 * ------------------------------------------------------------------------------------------------------
 * Resolves the principal for a request from its {@code Authorization: Bearer <token>} header with one
 * lookup against the token store. A valid token puts an {@link AuthenticatedUser} into the security
 * context; a missing or invalid token leaves the request anonymous, and the authorization rules in
 * SecurityConfig then answer 401 for protected routes.
 * ------------------------------------------------------------------------------------------------------
 */
@Slf4j
public class AccessTokenAuthenticationFilter extends OncePerRequestFilter {

    private final AccessTokenService accessTokenService;

    public AccessTokenAuthenticationFilter(AccessTokenService accessTokenService) {
        this.accessTokenService = accessTokenService;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String token = BearerTokens.resolve(request.getHeader(HttpHeaders.AUTHORIZATION));

        if (token != null) {
            Optional<AuthenticatedUser> principal = accessTokenService.validate(token);
            if (principal.isPresent()) {
                UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                        principal.get(), null, AuthorityUtils.createAuthorityList("ROLE_USER"));

                SecurityContext context = SecurityContextHolder.createEmptyContext();
                context.setAuthentication(authentication);
                SecurityContextHolder.setContext(context);
            } else {
                log.debug("[AUTH_TOKEN_REJECTED] Bearer token did not resolve to a user | path={}",
                        request.getRequestURI());
            }
        }

        filterChain.doFilter(request, response);
    }
}
