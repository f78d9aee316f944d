package com.contactbook.backend.global.security;

import java.io.IOException;

import com.contactbook.backend.global.error.ProblemException;
import com.contactbook.backend.global.error.ProblemResponse;

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
        ProblemResponse body = ProblemResponse.of(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", "Authentication required", request.getRequestURI());
        write(response, HttpStatus.UNAUTHORIZED, body);
    }

    /**
     * Renders a problem raised before the request reached a controller (for example in a filter).
     */
    public void commence(HttpServletRequest request, HttpServletResponse response, ProblemException problem)
            throws IOException {
        ProblemResponse body = ProblemResponse.from(problem, request.getRequestURI());
        write(response, problem.getHttpStatus(), body);
    }

    private void write(HttpServletResponse response, HttpStatus status, ProblemResponse body) throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
