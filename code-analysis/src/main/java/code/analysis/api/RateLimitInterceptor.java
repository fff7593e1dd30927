package code.analysis.api;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed one-minute window per client address.
 */
@Component
public class RateLimitInterceptor implements HandlerInterceptor {
    private static final Logger log = LoggerFactory.getLogger(RateLimitInterceptor.class);
    private static final long WINDOW_MS = Duration.ofMinutes(1).toMillis();

    private final int requestsPerMinute;
    private final Clock clock;
    private final ConcurrentMap<String, Window> windows = new ConcurrentHashMap<>();
    private final AtomicLong sweptWindow = new AtomicLong(Long.MIN_VALUE);

    @Autowired
    public RateLimitInterceptor(@Value("${code.analysis.rate-limit.requests-per-minute:300}") int requestsPerMinute) {
        this(requestsPerMinute, Clock.systemUTC());
    }

    RateLimitInterceptor(int requestsPerMinute, Clock clock) {
        this.requestsPerMinute = Math.max(1, requestsPerMinute);
        this.clock = clock;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws IOException {
        String client = request.getRemoteAddr() == null ? "unknown" : request.getRemoteAddr();
        long windowStart = clock.millis() / WINDOW_MS * WINDOW_MS;
        evictStale(windowStart);
        Window window = windows.compute(client, (key, current) ->
                current == null || current.start() != windowStart
                        ? new Window(windowStart, 1)
                        : new Window(windowStart, current.count() + 1));

        response.setHeader("X-RateLimit-Limit", String.valueOf(requestsPerMinute));
        response.setHeader("X-RateLimit-Remaining", String.valueOf(Math.max(0, requestsPerMinute - window.count())));
        if (window.count() > requestsPerMinute) {
            log.warn("Rate limit exceeded for {}", client);
            response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            response.getWriter().write("{\"success\":false,\"error\":\"Rate limit exceeded. Try again later.\"}");
            return false;
        }
        return true;
    }

    int trackedClients() {
        return windows.size();
    }

    private void evictStale(long windowStart) {
        long previous = sweptWindow.get();
        if (previous != windowStart && sweptWindow.compareAndSet(previous, windowStart)) {
            windows.values().removeIf(window -> window.start() < windowStart);
        }
    }

    private record Window(long start, int count) {}
}
