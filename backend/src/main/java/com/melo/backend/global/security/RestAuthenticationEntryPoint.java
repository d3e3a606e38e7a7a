package com.melo.backend.global.security;

import java.io.IOException;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * 401 for requests that reach an authenticated route without a usable bearer token. A token the
 * filter rejected is reported as {@code INVALID_TOKEN}, a missing one as {@code MISSING_TOKEN}.
 */
@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final SecurityProblemWriter problemWriter;

    public RestAuthenticationEntryPoint(SecurityProblemWriter problemWriter) {
        this.problemWriter = problemWriter;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        Object rejection = request.getAttribute(JwtAuthenticationFilter.TOKEN_REJECTION_ATTRIBUTE);
        if (rejection != null) {
            response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer error=\"invalid_token\"");
            problemWriter.write(request, response, HttpStatus.UNAUTHORIZED, "INVALID_TOKEN",
                    "Bearer token rejected: " + rejection);
            return;
        }
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        problemWriter.write(request, response, HttpStatus.UNAUTHORIZED, "MISSING_TOKEN",
                "A bearer token whose subject is a Matrix user id is required");
    }
}
