package com.aera.backend.global.security;

import java.io.IOException;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * Answers 401 with a Bearer challenge. A request whose token was presented but rejected gets
 * {@code invalid_token} so clients know to refresh instead of prompting for login.
 */
@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    static final String CODE_UNAUTHORIZED = "unauthorized";
    static final String CODE_INVALID_TOKEN = "invalid_token";

    private final ProblemResponseWriter problemWriter;

    public RestAuthenticationEntryPoint(ProblemResponseWriter problemWriter) {
        this.problemWriter = problemWriter;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        if (request.getAttribute(JwtAuthenticationFilter.REJECTED_TOKEN_ATTRIBUTE) != null) {
            response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer error=\"invalid_token\"");
            problemWriter.write(request, response, HttpStatus.UNAUTHORIZED, CODE_INVALID_TOKEN,
                    "access token is invalid or expired");
            return;
        }
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        problemWriter.write(request, response, HttpStatus.UNAUTHORIZED, CODE_UNAUTHORIZED,
                "a bearer access token is required");
    }
}
