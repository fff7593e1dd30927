package code.analysis.api;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class RateLimitInterceptorTest {
    private static final Instant START = Instant.parse("2026-01-01T10:00:05Z");

    @Test
    void shouldRejectRequestsOverTheLimitWithinOneWindow() throws Exception {
        RateLimitInterceptor interceptor = new RateLimitInterceptor(2, Clock.fixed(START, ZoneOffset.UTC));

        assertTrue(interceptor.preHandle(request("10.0.0.1"), new MockHttpServletResponse(), null));
        MockHttpServletResponse second = new MockHttpServletResponse();
        assertTrue(interceptor.preHandle(request("10.0.0.1"), second, null));
        assertEquals("0", second.getHeader("X-RateLimit-Remaining"));

        MockHttpServletResponse third = new MockHttpServletResponse();
        assertFalse(interceptor.preHandle(request("10.0.0.1"), third, null));
        assertEquals(429, third.getStatus());
        assertEquals("2", third.getHeader("X-RateLimit-Limit"));
        assertTrue(third.getContentAsString().contains("Rate limit exceeded"));
    }

    @Test
    void shouldTrackClientsSeparately() throws Exception {
        RateLimitInterceptor interceptor = new RateLimitInterceptor(1, Clock.fixed(START, ZoneOffset.UTC));

        assertTrue(interceptor.preHandle(request("10.0.0.1"), new MockHttpServletResponse(), null));
        assertTrue(interceptor.preHandle(request("10.0.0.2"), new MockHttpServletResponse(), null));
        assertFalse(interceptor.preHandle(request("10.0.0.1"), new MockHttpServletResponse(), null));
    }

    @Test
    void shouldResetInTheNextWindow() throws Exception {
        MutableClock clock = new MutableClock(START);
        RateLimitInterceptor interceptor = new RateLimitInterceptor(1, clock);
        assertTrue(interceptor.preHandle(request("10.0.0.1"), new MockHttpServletResponse(), null));
        assertFalse(interceptor.preHandle(request("10.0.0.1"), new MockHttpServletResponse(), null));
        clock.instant = START.plusSeconds(60);
        assertTrue(interceptor.preHandle(request("10.0.0.1"), new MockHttpServletResponse(), null));
    }

    @Test
    void shouldForgetClientsFromPreviousWindows() throws Exception {
        MutableClock clock = new MutableClock(START);
        RateLimitInterceptor interceptor = new RateLimitInterceptor(5, clock);
        for (int i = 0; i < 100; i++) {
            interceptor.preHandle(request("10.0.1." + i), new MockHttpServletResponse(), null);
        }
        assertEquals(100, interceptor.trackedClients());

        clock.instant = START.plusSeconds(60);
        assertTrue(interceptor.preHandle(request("10.0.2.1"), new MockHttpServletResponse(), null));

        assertEquals(1, interceptor.trackedClients());
    }

    private static MockHttpServletRequest request(String remoteAddr) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/analyze");
        request.setRemoteAddr(remoteAddr);
        return request;
    }

    private static final class MutableClock extends Clock {
        private Instant instant;

        private MutableClock(Instant instant) {
            this.instant = instant;
        }

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }
}
