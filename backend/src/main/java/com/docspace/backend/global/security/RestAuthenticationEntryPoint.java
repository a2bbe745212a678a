package com.docspace.backend.global.security;

import java.io.IOException;

import com.docspace.backend.global.error.ProblemResponse;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;

    public RestAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        writeUnauthorized(request, response, "UNAUTHORIZED");
    }

    /**
     * Writes a 401 problem body carrying {@code code}. Used for bearer token failures inside the filter chain,
     * where the MVC exception handler does not apply.
     */
    public void writeUnauthorized(HttpServletRequest request, HttpServletResponse response, String code)
            throws IOException {
        ProblemResponse body = ProblemResponse.of(HttpStatus.UNAUTHORIZED, code, code, request.getRequestURI());

        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
