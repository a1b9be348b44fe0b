package com.weatherdash.backend.auth.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Collections;

@Component
public class AccessTokenFilter extends OncePerRequestFilter {

    static final String PROFILE_PATH = "/api/auth/profile";

    private final AccessTokenService accessTokens;

    public AccessTokenFilter(AccessTokenService accessTokens) {
        this.accessTokens = accessTokens;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String p = request.getRequestURI();
        // credential endpoints are public; a stale bearer header must not break login/refresh
        return p.startsWith("/api/auth/") && !p.equals(PROFILE_PATH);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String auth = req.getHeader(HttpHeaders.AUTHORIZATION);
        if (auth == null || !auth.startsWith("Bearer ")) {
            chain.doFilter(req, res); // anonymous; the entry point answers 401 where needed
            return;
        }

        var claims = accessTokens.verify(auth.substring(7).trim()).orElse(null);
        if (claims == null) {
            unauthorized(res);
            return;
        }

        // principal is the user id only, never the entity
        var authentication = new UsernamePasswordAuthenticationToken(
                claims.userId(),
                null,
                Collections.emptyList()
        );
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(req));
        SecurityContextHolder.getContext().setAuthentication(authentication);

        chain.doFilter(req, res);
    }

    private static void unauthorized(HttpServletResponse res) throws IOException {
        res.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        res.setContentType("application/json");
        res.getWriter().write("{\"code\":\"UNAUTHORIZED\",\"message\":\"Invalid or expired access token\"}");
    }
}
