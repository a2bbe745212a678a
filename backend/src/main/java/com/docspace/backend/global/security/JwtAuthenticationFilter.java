package com.docspace.backend.global.security;

import java.io.IOException;
import java.util.List;

import com.docspace.backend.global.error.ProblemException;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    static final String AUTHORITY_PREFIX = "PERM_";

    private final AuthorizationGate authorizationGate;
    private final RestAuthenticationEntryPoint authenticationEntryPoint;

    public JwtAuthenticationFilter(AuthorizationGate authorizationGate, RestAuthenticationEntryPoint authenticationEntryPoint) {
        this.authorizationGate = authorizationGate;
        this.authenticationEntryPoint = authenticationEntryPoint;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String token = BearerTokens.extract(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (token != null) {
            try {
                JwtAuthenticationPrincipal principal = authorizationGate.authenticate(token);
                List<SimpleGrantedAuthority> authorities = principal.permissions().stream()
                        .map(permission -> new SimpleGrantedAuthority(AUTHORITY_PREFIX + permission))
                        .toList();

                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(principal, token, authorities);
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } catch (ProblemException ex) {
                SecurityContextHolder.clearContext();
                log.debug("Bearer token rejected on {}: {}", request.getRequestURI(), ex.getCode());
                authenticationEntryPoint.writeUnauthorized(request, response, ex.getCode());
                return;
            }
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        String path = request.getServletPath();
        return SecurityConfig.PUBLIC_AUTH_PATHS.contains(path)
                || path.equals("/health")
                || path.equals("/readyz")
                || path.equals("/actuator/health")
                || path.startsWith("/actuator/health/");
    }
}
