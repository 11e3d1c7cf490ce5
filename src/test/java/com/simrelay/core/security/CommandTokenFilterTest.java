package com.simrelay.core.security;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.junit.jupiter.api.Assertions.*;

class CommandTokenFilterTest {

    private RelayProperties properties;
    private CommandTokenFilter filter;

    @BeforeEach
    void setUp() {
        properties = new RelayProperties();
        properties.setCommandToken("s3cret");
        filter = new CommandTokenFilter(properties);
    }

    private MockHttpServletResponse run(String path, String token, MockFilterChain chain) throws Exception {
        var request = new MockHttpServletRequest("GET", path);
        if (token != null) {
            request.addHeader(CommandTokenFilter.HEADER, token);
        }
        var response = new MockHttpServletResponse();
        filter.doFilter(request, response, chain);
        return response;
    }

    @Test
    @DisplayName("matching token passes through")
    void matchingToken() throws Exception {
        var chain = new MockFilterChain();
        var response = run("/api/commands/next", "s3cret", chain);
        assertEquals(200, response.getStatus());
        assertNotNull(chain.getRequest());
    }

    @Test
    @DisplayName("missing, empty or wrong token is rejected with JSON 401")
    void rejectsBadTokens() throws Exception {
        for (String token : new String[]{null, "", "s3cre", "s3cret!"}) {
            var chain = new MockFilterChain();
            var response = run("/api/commands", token, chain);
            assertEquals(401, response.getStatus());
            assertTrue(response.getContentAsString().contains("\"detail\""));
            assertNull(chain.getRequest());
        }
    }

    @Test
    @DisplayName("unset server token rejects every caller")
    void unsetServerToken() throws Exception {
        properties.setCommandToken("");
        var chain = new MockFilterChain();
        assertEquals(401, run("/api/commands/abc", "", chain).getStatus());
        assertFalse(filter.isAuthorized("anything"));
    }

    @Test
    @DisplayName("encoded and path-parameter variants of the command routes are guarded")
    void disguisedCommandPaths() throws Exception {
        String[] paths = {
                "/api/commands;x=1",
                "/api/commands;x=1/next",
                "/api;v=2/commands",
                "/api/%63ommands",
                "/api/%63ommands/next",
                "/api//commands",
                "/API/Commands"
        };
        for (String path : paths) {
            var chain = new MockFilterChain();
            var response = run(path, null, chain);
            assertEquals(401, response.getStatus(), path);
            assertNull(chain.getRequest(), path);
        }
    }

    @Test
    @DisplayName("disguised command path with the right token passes through")
    void disguisedPathWithToken() throws Exception {
        var chain = new MockFilterChain();
        run("/api/%63ommands;x=1/next", "s3cret", chain);
        assertNotNull(chain.getRequest());
    }

    @Test
    @DisplayName("guarded path matching ignores case")
    void isProtected() {
        assertTrue(CommandTokenFilter.isProtected("/api/commands"));
        assertTrue(CommandTokenFilter.isProtected("/API/COMMANDS/next"));
        assertFalse(CommandTokenFilter.isProtected("/api/commandsx"));
        assertFalse(CommandTokenFilter.isProtected("/api/state"));
    }

    @Test
    @DisplayName("state and health routes are not guarded")
    void unprotectedRoutes() throws Exception {
        for (String path : new String[]{"/api/state", "/api/health", "/api/commandsx"}) {
            var chain = new MockFilterChain();
            run(path, null, chain);
            assertNotNull(chain.getRequest(), path);
        }
    }
}
