package com.aura.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingRequestWrapper;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * 统一 HTTP 链路日志过滤器：写入 traceId/requestId 到 MDC 与响应头，输出 HTTP_IN / HTTP_OUT。
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RequestTraceLoggingFilter extends OncePerRequestFilter {

    private static final String HEADER_TRACE_ID = "X-Trace-Id";
    private static final String HEADER_REQUEST_ID = "X-Request-Id";
    private static final String MDC_TRACE_ID = "traceId";
    private static final String MDC_REQUEST_ID = "requestId";
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<Map<String, Object>>() {
    };

    private final ObjectMapper objectMapper;
    private final ObservabilityHttpLogProperties properties;
    private final AntPathMatcher pathMatcher;

    public RequestTraceLoggingFilter(ObjectMapper objectMapper,
                                     ObservabilityHttpLogProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.pathMatcher = new AntPathMatcher();
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (request == null || !properties.isEnabled()) {
            return true;
        }
        String path = normalizePath(request.getRequestURI());
        if (matchesAny(path, properties.getExcludePathPatterns())) {
            return true;
        }
        List<String> includePatterns = properties.getIncludePathPatterns();
        if (includePatterns == null || includePatterns.isEmpty()) {
            return false;
        }
        return !matchesAny(path, includePatterns);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String traceId = resolveOrCreateHeader(request.getHeader(HEADER_TRACE_ID));
        String requestId = resolveOrCreateHeader(request.getHeader(HEADER_REQUEST_ID));
        String path = normalizePath(request.getRequestURI());
        String method = request.getMethod();

        response.setHeader(HEADER_TRACE_ID, traceId);
        response.setHeader(HEADER_REQUEST_ID, requestId);
        MDC.put(MDC_TRACE_ID, traceId);
        MDC.put(MDC_REQUEST_ID, requestId);

        ContentCachingRequestWrapper requestWrapper = request instanceof ContentCachingRequestWrapper
                ? (ContentCachingRequestWrapper) request
                : new ContentCachingRequestWrapper(request);
        ContentCachingResponseWrapper responseWrapper = response instanceof ContentCachingResponseWrapper
                ? (ContentCachingResponseWrapper) response
                : new ContentCachingResponseWrapper(response);

        long startNs = System.nanoTime();
        log.info("HTTP_IN method={}, path={}, contentType={}, contentLength={}",
                method, path, StringUtils.defaultIfBlank(request.getContentType(), "-"), request.getContentLengthLong());

        Throwable error = null;
        try {
            filterChain.doFilter(requestWrapper, responseWrapper);
        } catch (IOException | ServletException | RuntimeException ex) {
            error = ex;
            throw ex;
        } finally {
            long costMs = (System.nanoTime() - startNs) / 1_000_000L;
            String responseCode = extractResponseCode(responseWrapper);
            String requestBodySummary = extractRequestBodySummary(requestWrapper);
            if (error == null) {
                boolean slow = costMs >= Math.max(properties.getSlowRequestThresholdMs(), 0L);
                String template = "HTTP_OUT method={}, path={}, status={}, responseCode={}, costMs={}, slow={}, requestBodySummary={}";
                Object[] args = {method, path, responseWrapper.getStatus(),
                        StringUtils.defaultIfBlank(responseCode, "-"), costMs, slow, requestBodySummary};
                if (slow) {
                    log.warn(template, args);
                } else {
                    log.info(template, args);
                }
            } else {
                log.warn("HTTP_OUT method={}, path={}, status={}, costMs={}, errorType={}, errorMessage={}, requestBodySummary={}",
                        method,
                        path,
                        responseWrapper.getStatus(),
                        costMs,
                        error.getClass().getSimpleName(),
                        truncate(error.getMessage(), 200),
                        requestBodySummary);
            }
            responseWrapper.copyBodyToResponse();
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_TRACE_ID);
        }
    }

    private String resolveOrCreateHeader(String value) {
        if (StringUtils.isNotBlank(value)) {
            return value.trim();
        }
        return UUID.randomUUID().toString().replace("-", "");
    }

    private String extractResponseCode(ContentCachingResponseWrapper responseWrapper) {
        byte[] body = responseWrapper.getContentAsByteArray();
        if (body.length == 0 || !isJson(responseWrapper.getContentType())) {
            return null;
        }
        try {
            Object code = objectMapper.readValue(body, MAP_REF).get("code");
            return code == null ? null : String.valueOf(code);
        } catch (IOException ex) {
            log.debug("Response body is not a JSON envelope. error={}", ex.getMessage());
            return null;
        }
    }

    private String extractRequestBodySummary(ContentCachingRequestWrapper requestWrapper) {
        if (!properties.isLogRequestBody() || !isJson(requestWrapper.getContentType())) {
            return "-";
        }
        byte[] body = requestWrapper.getContentAsByteArray();
        if (body.length == 0) {
            return "-";
        }
        try {
            Map<String, Object> source = objectMapper.readValue(body, MAP_REF);
            Map<String, Object> summary = new LinkedHashMap<>();
            List<String> whitelist = properties.getRequestBodyWhitelist();
            if (whitelist != null) {
                for (String key : whitelist) {
                    if (StringUtils.isNotBlank(key) && source.containsKey(key)) {
                        summary.put(key, source.get(key));
                    }
                }
            }
            if (summary.isEmpty()) {
                return "-";
            }
            return truncate(objectMapper.writeValueAsString(summary), Math.max(64, properties.getMaxBodyLength()));
        } catch (JsonProcessingException ex) {
            return "<unparseable>";
        } catch (IOException ex) {
            log.debug("Failed to read cached request body. error={}", ex.getMessage());
            return "-";
        }
    }

    private boolean isJson(String contentType) {
        return StringUtils.isNotBlank(contentType)
                && contentType.toLowerCase(Locale.ROOT).contains(MediaType.APPLICATION_JSON_VALUE);
    }

    private boolean matchesAny(String path, List<String> patterns) {
        if (StringUtils.isBlank(path) || patterns == null || patterns.isEmpty()) {
            return false;
        }
        for (String pattern : patterns) {
            if (StringUtils.isNotBlank(pattern) && pathMatcher.match(pattern.trim(), path)) {
                return true;
            }
        }
        return false;
    }

    private String normalizePath(String path) {
        return StringUtils.defaultIfBlank(path, "/").trim();
    }

    private String truncate(String text, int maxLength) {
        if (StringUtils.isBlank(text) || maxLength <= 0 || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }
}
