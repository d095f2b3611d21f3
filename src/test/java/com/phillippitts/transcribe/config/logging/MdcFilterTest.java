package com.phillippitts.transcribe.config.logging;

import jakarta.servlet.FilterChain;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MdcFilterTest {

    private final MdcFilter filter = new MdcFilter();

    @Test
    void propagatesClientRequestIdAndClearsAfterwards() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("POST", "/api/v1/transcribe");
        req.addHeader(MdcFilter.REQUEST_ID_HEADER, "client-123");
        MockHttpServletResponse res = new MockHttpServletResponse();
        Map<String, String> seen = new HashMap<>();
        FilterChain chain = (request, response) -> seen.putAll(ThreadContext.getImmutableContext());

        filter.doFilter(req, res, chain);

        assertThat(seen).containsEntry("requestId", "client-123")
                .containsEntry("method", "POST")
                .containsEntry("uri", "/api/v1/transcribe");
        assertThat(res.getHeader(MdcFilter.REQUEST_ID_HEADER)).isEqualTo("client-123");
        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void generatesRequestIdWhenHeaderMissing() throws Exception {
        MockHttpServletResponse res = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest("GET", "/health"), res, (request, response) -> { });

        assertThat(res.getHeader(MdcFilter.REQUEST_ID_HEADER)).hasSize(36);
    }

    @Test
    void replacesOversizedOrControlCharacterIds() throws Exception {
        MockHttpServletRequest longId = new MockHttpServletRequest("GET", "/health");
        longId.addHeader(MdcFilter.REQUEST_ID_HEADER, "x".repeat(200));
        MockHttpServletResponse res1 = new MockHttpServletResponse();
        filter.doFilter(longId, res1, (request, response) -> { });

        MockHttpServletRequest injected = new MockHttpServletRequest("GET", "/health");
        injected.addHeader(MdcFilter.REQUEST_ID_HEADER, "abc\nFAKE LOG LINE");
        MockHttpServletResponse res2 = new MockHttpServletResponse();
        filter.doFilter(injected, res2, (request, response) -> { });

        assertThat(res1.getHeader(MdcFilter.REQUEST_ID_HEADER)).hasSize(36);
        assertThat(res2.getHeader(MdcFilter.REQUEST_ID_HEADER)).doesNotContain("FAKE");
    }

    @Test
    void clearsContextEvenWhenChainThrows() {
        FilterChain failing = (request, response) -> {
            throw new IllegalStateException("boom");
        };

        try {
            filter.doFilter(new MockHttpServletRequest("GET", "/x"), new MockHttpServletResponse(), failing);
        } catch (Exception expected) {
            assertThat(expected).hasMessage("boom");
        }

        assertThat(ThreadContext.isEmpty()).isTrue();
    }
}
