package com.studentregistry.backend.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * One line per request. Failed requests are logged at WARN together with the
 * error kind the exception handler reported (NOT_FOUND, VALIDATION_FAILED, ...).
 */
@Component
public class ApiLoggingFilter extends OncePerRequestFilter {

    /** Request attribute holding the error kind written to the response body. */
    public static final String ERROR_KIND = ApiLoggingFilter.class.getName() + ".errorKind";

    private static final Logger log = LoggerFactory.getLogger(ApiLoggingFilter.class);

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        long t0 = System.nanoTime();
        try {
            chain.doFilter(req, res);
        } finally {
            long ms = (System.nanoTime() - t0) / 1_000_000;
            String target = req.getQueryString() == null
                    ? req.getRequestURI()
                    : req.getRequestURI() + "?" + req.getQueryString();
            int status = res.getStatus();
            if (status >= 400) {
                Object kind = req.getAttribute(ERROR_KIND);
                log.warn("{} {} -> {} {} ({}ms)", req.getMethod(), target, status,
                        kind == null ? "-" : kind, ms);
            } else {
                log.info("{} {} -> {} ({}ms)", req.getMethod(), target, status, ms);
            }
        }
    }
}
