package com.phillippitts.transcribe.config.security;

import com.phillippitts.transcribe.config.logging.MdcFilter;
import com.phillippitts.transcribe.config.properties.ApiKeyProperties;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.json.JSONObject;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.List;

/**
 * Requires a pre-shared key in {@code X-API-Key} on the transcription endpoint.
 *
 * <ul>
 *   <li>header missing or blank: 401 with {@code WWW-Authenticate: ApiKey}</li>
 *   <li>key not configured: 403</li>
 * </ul>
 *
 * <p>Keys are compared in constant time. Health and model listing stay open. Runs right
 * after {@link MdcFilter} so rejections carry a request id.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class ApiKeyFilter implements Filter {

    private static final Logger LOG = LogManager.getLogger(ApiKeyFilter.class);

    public static final String API_KEY_HEADER = "X-API-Key";
    static final String PROTECTED_PATH = "/api/v1/transcribe";

    private final List<byte[]> acceptedKeys;

    public ApiKeyFilter(ApiKeyProperties props) {
        this.acceptedKeys = props.apiKeys().stream()
                .map(k -> k.getBytes(StandardCharsets.UTF_8))
                .toList();
        if (acceptedKeys.isEmpty()) {
            LOG.warn("No API keys configured (security.api-keys); every transcription request will be rejected");
        }
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest http) || !(response instanceof HttpServletResponse httpResponse)
                || !requiresKey(http)) {
            chain.doFilter(request, response);
            return;
        }

        String key = http.getHeader(API_KEY_HEADER);
        if (key == null || key.isBlank()) {
            LOG.warn("Rejected {} {}: missing API key", http.getMethod(), http.getRequestURI());
            httpResponse.setHeader("WWW-Authenticate", "ApiKey");
            reject(httpResponse, HttpServletResponse.SC_UNAUTHORIZED, "Unauthorized",
                    "Missing X-API-Key header");
            return;
        }
        if (!isAccepted(key)) {
            LOG.warn("Rejected {} {}: invalid API key", http.getMethod(), http.getRequestURI());
            reject(httpResponse, HttpServletResponse.SC_FORBIDDEN, "Forbidden", "Invalid API key");
            return;
        }
        chain.doFilter(request, response);
    }

    private static boolean requiresKey(HttpServletRequest http) {
        if (HttpMethod.OPTIONS.matches(http.getMethod())) {
            return false;
        }
        String path = http.getRequestURI().substring(http.getContextPath().length());
        return path.equals(PROTECTED_PATH) || path.startsWith(PROTECTED_PATH + "/");
    }

    private boolean isAccepted(String key) {
        byte[] candidate = key.getBytes(StandardCharsets.UTF_8);
        boolean match = false;
        for (byte[] accepted : acceptedKeys) {
            // check every key so timing does not reveal which one matched
            match |= MessageDigest.isEqual(accepted, candidate);
        }
        return match;
    }

    private static void reject(HttpServletResponse response, int status, String error, String detail)
            throws IOException {
        JSONObject body = new JSONObject()
                .put("error", error)
                .put("detail", detail)
                .put("request_id", ThreadContext.get(MdcFilter.REQUEST_ID_KEY))
                .put("timestamp", Instant.now().toString());
        response.setStatus(status);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write(body.toString());
    }
}
