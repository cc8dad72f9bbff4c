package com.gamefamily.tenant;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.UUID;

/**
 * Binds the {@code TENANT_ID} request header to {@link TenantContext} for the duration of an API call.
 */
@Component
public class TenantInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(TenantInterceptor.class);

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws Exception {
        String header = request.getHeader(TenantContext.HEADER);
        if (header == null || header.isBlank()) {
            response.sendError(HttpStatus.BAD_REQUEST.value(), "Missing " + TenantContext.HEADER + " header");
            return false;
        }
        try {
            TenantContext.set(UUID.fromString(header.trim()));
        } catch (IllegalArgumentException e) {
            log.warn("Rejecting request with malformed tenant id: {}", header);
            response.sendError(HttpStatus.BAD_REQUEST.value(), "Malformed " + TenantContext.HEADER + " header");
            return false;
        }
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        TenantContext.clear();
    }
}
