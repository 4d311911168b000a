package com.di.organizer.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for MdcRequestFilter and RequestLoggingFilter.
 */
@DisplayName("Request Filter Tests")
class MdcRequestFilterTest {

    @Test
    @DisplayName("Should expose request id and path in the MDC only while the request runs")
    void testMdcKeys() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/orders");
        AtomicReference<String> seenId = new AtomicReference<>();
        AtomicReference<String> seenPath = new AtomicReference<>();

        new MdcRequestFilter().doFilter(request, new MockHttpServletResponse(), (req, res) -> {
            seenId.set(MDC.get(MdcRequestFilter.REQUEST_ID));
            seenPath.set(MDC.get(MdcRequestFilter.REQUEST_PATH));
        });

        assertNotNull(seenId.get());
        assertTrue(seenId.get().startsWith("req-"));
        assertEquals("/api/orders", seenPath.get());
        assertNull(MDC.get(MdcRequestFilter.REQUEST_ID));
        assertNull(MDC.get(MdcRequestFilter.REQUEST_PATH));
    }

    @Test
    @DisplayName("Should pass the request through when logging a JSON body")
    void testRequestLogging_PassesThrough() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/orders");
        request.setContentType("application/json");
        request.setContent("{\"data\": {\"Priority\": 1}}".getBytes());
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> body = new AtomicReference<>();

        new RequestLoggingFilter().doFilter(request, response, (req, res) -> {
            body.set(new String(req.getInputStream().readAllBytes()));
            ((jakarta.servlet.http.HttpServletResponse) res).setStatus(201);
        });

        assertEquals("{\"data\": {\"Priority\": 1}}", body.get());
        assertEquals(201, response.getStatus());
    }
}
