package com.flagship.bill_settlement.observability;

import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationContextTest {

    @AfterEach
    void tearDown() {
        CorrelationContext.clear();
        MDC.clear();
    }

    @Test
    @DisplayName("Well-formed ids are kept")
    void testWellFormedIdKept() {
        assertEquals("dinner-42", CorrelationContext.bind("dinner-42"));
        assertEquals("dinner-42", CorrelationContext.current());
    }

    @Test
    @DisplayName("Ids with line breaks, spaces or excess length are replaced")
    void testMalformedIdsReplaced() {
        String[] malformed = {"abc\nFAKE LOG", "abc\r\n", "two words", "x".repeat(65), "", null};

        for (String requested : malformed) {
            String bound = CorrelationContext.bind(requested);

            assertNotEquals(requested, bound);
            assertTrue(bound.matches("[0-9a-f]{8}"), bound);
        }
    }

    @Test
    @DisplayName("An id of exactly 64 characters is accepted")
    void testMaximumLengthAccepted() {
        String id = "a".repeat(64);

        assertEquals(id, CorrelationContext.bind(id));
    }

    @Test
    @DisplayName("Filter puts the sanitized id in the MDC and header, then clears it")
    void testFilterSanitizesHeader() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/settlements");
        request.addHeader(CorrelationContext.CORRELATION_ID_HEADER, "abc\nFAKE LOG");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenInMdc = new AtomicReference<>();

        FilterChain chain = (req, res) -> seenInMdc.set(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));

        new CorrelationIdFilter().doFilter(request, response, chain);

        String echoed = response.getHeader(CorrelationContext.CORRELATION_ID_HEADER);
        assertTrue(echoed.matches("[0-9a-f]{8}"), echoed);
        assertEquals(echoed, seenInMdc.get());
        assertNull(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
        assertNull(CorrelationContext.current());
    }
}
