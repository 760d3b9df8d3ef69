package com.community.kolokwa.filter;

import com.community.kolokwa.dto.CommonResponse;
import com.community.kolokwa.util.ReconciliationStatusManager;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Refuses mutating API requests with 423 (Locked) while counter reconciliation runs.
 * Reads stay available; the reconcile endpoint itself is never blocked.
 */
public class ReconciliationLockFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationLockFilter.class);

    public static final int SC_LOCKED = 423;
    private static final String RECONCILE_PATH = "/api/admin/reconcile";

    private final ReconciliationStatusManager statusManager;
    private final ObjectMapper objectMapper;

    public ReconciliationLockFilter(ReconciliationStatusManager statusManager, ObjectMapper objectMapper) {
        this.statusManager = statusManager;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {

        if (statusManager.isReconciliationInProgress() && isMutating(request)) {
            log.warn("Refused request: {} {} (reconciliation in progress)",
                    request.getMethod(), request.getRequestURI());

            response.setStatus(SC_LOCKED);
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            response.setCharacterEncoding(StandardCharsets.UTF_8.name());

            CommonResponse<Void> errorResponse = CommonResponse.error(
                    SC_LOCKED, "Counters are being reconciled, please try again shortly");
            response.getWriter().write(objectMapper.writeValueAsString(errorResponse));
            return;
        }

        chain.doFilter(request, response);
    }

    private boolean isMutating(HttpServletRequest request) {
        String method = request.getMethod();
        if (HttpMethod.GET.matches(method) || HttpMethod.HEAD.matches(method) || HttpMethod.OPTIONS.matches(method)) {
            return false;
        }
        return !request.getRequestURI().startsWith(RECONCILE_PATH);
    }
}
