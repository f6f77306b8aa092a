package com.rewardpick.auth.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class AdminKeyAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AdminKeyAuthenticationFilter.class);

    public static final String HEADER_NAME = "X-Admin-Key";
    public static final String ROLE_ADMIN = "ROLE_ADMIN";

    private final byte[] expectedKey;

    public AdminKeyAuthenticationFilter(AdminProperties properties) {
        String apiKey = properties.apiKey() == null ? "" : properties.apiKey().trim();
        this.expectedKey = apiKey.getBytes(StandardCharsets.UTF_8);
        if (apiKey.isEmpty()) {
            log.warn("app.admin.api-key is not set; admin endpoints will reject every request");
        }
    }

    @Override
    protected void doFilterInternal(
        HttpServletRequest request,
        HttpServletResponse response,
        FilterChain filterChain
    ) throws ServletException, IOException {
        String header = request.getHeader(HEADER_NAME);

        if (header == null || header.isBlank() || expectedKey.length == 0) {
            filterChain.doFilter(request, response);
            return;
        }

        if (MessageDigest.isEqual(expectedKey, header.trim().getBytes(StandardCharsets.UTF_8))) {
            UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                "admin",
                null,
                List.of(new SimpleGrantedAuthority(ROLE_ADMIN))
            );
            authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
            SecurityContextHolder.getContext().setAuthentication(authentication);
        } else {
            log.warn("Rejected admin key (path={}, remote={})", request.getRequestURI(), request.getRemoteAddr());
            SecurityContextHolder.clearContext();
        }

        filterChain.doFilter(request, response);
    }
}
