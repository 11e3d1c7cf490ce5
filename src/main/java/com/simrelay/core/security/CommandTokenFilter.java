package com.simrelay.core.security;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UrlPathHelper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Locale;

/**
 * Requires a matching {@code X-Command-Token} header on every {@code /api/commands} request.
 * An unset server token rejects everything.
 * <p>
 * The path is checked after URL decoding and removal of {@code ;} path parameters, the
 * same form request mapping sees, so {@code /api/commands;x=1} or {@code /api/%63ommands}
 * are guarded like {@code /api/commands}.
 */
@Component
@Order(1)
public class CommandTokenFilter implements Filter {

    public static final String HEADER = "X-Command-Token";

    private static final Logger log = LoggerFactory.getLogger(CommandTokenFilter.class);
    private static final String PROTECTED_PREFIX = "/api/commands";
    private static final UrlPathHelper PATH_HELPER = UrlPathHelper.defaultInstance;

    private final RelayProperties relayProperties;

    public CommandTokenFilter(RelayProperties relayProperties) {
        this.relayProperties = relayProperties;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        String path = PATH_HELPER.getPathWithinApplication(httpRequest);
        if (!isProtected(path) || isAuthorized(httpRequest.getHeader(HEADER))) {
            chain.doFilter(request, response);
            return;
        }

        log.warn("Rejected {} {} with missing or invalid command token", httpRequest.getMethod(), path);
        httpResponse.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        httpResponse.setContentType("application/json");
        httpResponse.getWriter().write("{\"detail\":\"Invalid or missing command token\"}");
    }

    boolean isAuthorized(String presented) {
        if (!relayProperties.hasCommandToken() || presented == null || presented.isEmpty()) {
            return false;
        }
        return MessageDigest.isEqual(
                relayProperties.getCommandToken().getBytes(StandardCharsets.UTF_8),
                presented.getBytes(StandardCharsets.UTF_8));
    }

    static boolean isProtected(String path) {
        String normalized = path.toLowerCase(Locale.ROOT);
        return normalized.equals(PROTECTED_PREFIX) || normalized.startsWith(PROTECTED_PREFIX + "/");
    }
}
