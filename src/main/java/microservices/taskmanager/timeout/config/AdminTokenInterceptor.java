package microservices.taskmanager.timeout.config;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

import org.springframework.http.HttpHeaders;
import org.springframework.web.servlet.HandlerInterceptor;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import microservices.taskmanager.timeout.enums.ErrorCode;
import microservices.taskmanager.timeout.exception.TaskTimeoutException;

/**
 * Requires "Authorization: Bearer &lt;token&gt;" matching the configured admin
 * token. With no token configured every request is rejected.
 */
@Slf4j
public class AdminTokenInterceptor implements HandlerInterceptor {

    private static final String BEARER = "Bearer ";

    private final byte[] expectedToken;

    public AdminTokenInterceptor(String expectedToken) {
        this.expectedToken = expectedToken == null ? new byte[0] : expectedToken.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (expectedToken.length == 0 || header == null || !header.startsWith(BEARER)) {
            log.warn("Rejected unauthenticated request to {}", request.getRequestURI());
            throw new TaskTimeoutException("Missing or invalid admin token", ErrorCode.UNAUTHORIZED);
        }
        byte[] presented = header.substring(BEARER.length()).trim().getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(expectedToken, presented)) {
            log.warn("Rejected request to {} with wrong admin token", request.getRequestURI());
            throw new TaskTimeoutException("Missing or invalid admin token", ErrorCode.UNAUTHORIZED);
        }
        return true;
    }

}
