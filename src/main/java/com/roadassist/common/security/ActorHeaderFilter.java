package com.roadassist.common.security;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Reads the caller identity forwarded by the API gateway.
 *
 * <p>The gateway validates the token and forwards {@code X-User-Id} and {@code X-User-Role}.
 * When both are present and well formed an {@link Actor} is stored under the
 * {@link #ACTOR_ATTRIBUTE} request attribute. Requests without identity pass through
 * untouched; endpoints that need an actor reject them in {@link CurrentActorArgumentResolver}.</p>
 */
@Slf4j
@Component
public class ActorHeaderFilter implements Filter {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ROLE_HEADER = "X-User-Role";
    public static final String ACTOR_ATTRIBUTE = "actor";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        HttpServletRequest httpRequest = (HttpServletRequest) request;
        Actor actor = resolveActor(httpRequest);
        if (actor != null) {
            httpRequest.setAttribute(ACTOR_ATTRIBUTE, actor);
        }
        chain.doFilter(request, response);
    }

    private Actor resolveActor(HttpServletRequest request) {
        String userId = request.getHeader(USER_ID_HEADER);
        String role = request.getHeader(USER_ROLE_HEADER);
        if (userId == null || role == null) {
            return null;
        }
        try {
            return new Actor(Long.valueOf(userId.trim()), Role.valueOf(role.trim().toUpperCase()));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring malformed identity headers: userId={}, role={}", userId, role);
            return null;
        }
    }
}
