package com.shlawgathon.faceguard.backend.config;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.junit.jupiter.api.Assertions.*;

class InternalApiKeyAuthFilterTest {

    @Test
    void shouldRejectInternalCallWithoutKey() throws Exception {
        // Given
        InternalApiKeyAuthFilter filter = new InternalApiKeyAuthFilter("s3cret");
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/internal/index/embeddings");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        // When
        filter.doFilter(request, response, chain);

        // Then
        assertEquals(401, response.getStatus());
        assertTrue(response.getContentAsString().contains("\"error_kind\":\"unauthorized\""));
        assertNull(chain.getRequest());
    }

    @Test
    void shouldRejectWrongKey() throws Exception {
        InternalApiKeyAuthFilter filter = new InternalApiKeyAuthFilter("s3cret");
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/internal/recognition/events");
        request.addHeader(InternalApiKeyAuthFilter.API_KEY_HEADER, "guess");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        assertEquals(401, response.getStatus());
        assertTrue(response.getContentAsString().contains("Invalid API key"));
    }

    @Test
    void shouldPassMatchingKey() throws Exception {
        // Given
        InternalApiKeyAuthFilter filter = new InternalApiKeyAuthFilter("s3cret");
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/internal/index/snapshot");
        request.addHeader(InternalApiKeyAuthFilter.API_KEY_HEADER, "s3cret");
        MockFilterChain chain = new MockFilterChain();

        // When
        filter.doFilter(request, new MockHttpServletResponse(), chain);

        // Then
        assertSame(request, chain.getRequest());
    }

    @Test
    void shouldLeavePublicPathsAlone() throws Exception {
        InternalApiKeyAuthFilter filter = new InternalApiKeyAuthFilter("s3cret");
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/alerts");
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertSame(request, chain.getRequest());
    }

    @Test
    void shouldAllowEverythingWhenNoKeyConfigured() throws Exception {
        InternalApiKeyAuthFilter filter = new InternalApiKeyAuthFilter("");
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/internal/index/embeddings");
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertSame(request, chain.getRequest());
    }
}
