package com.community.kolokwa.filter;

import com.community.kolokwa.util.ReconciliationStatusManager;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.junit.jupiter.api.Assertions.*;

public class ReconciliationLockFilterTest {

    private ReconciliationStatusManager statusManager;
    private ReconciliationLockFilter filter;

    @BeforeEach
    void setUp() {
        statusManager = new ReconciliationStatusManager();
        filter = new ReconciliationLockFilter(statusManager, new ObjectMapper());
    }

    private MockHttpServletResponse run(String method, String uri) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest(method, uri);
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();
        filter.doFilter(request, response, chain);
        if (response.getStatus() != ReconciliationLockFilter.SC_LOCKED) {
            assertNotNull(chain.getRequest(), "request should reach the chain");
        }
        return response;
    }

    @Test
    void testIdlePassesEverything() throws Exception {
        assertEquals(200, run("POST", "/api/entries").getStatus());
        assertEquals(200, run("DELETE", "/api/entries/1").getStatus());
    }

    @Test
    void testLockedRefusesMutations() throws Exception {
        assertTrue(statusManager.tryStart());

        MockHttpServletResponse response = run("POST", "/api/entries/1/vote");

        assertEquals(423, response.getStatus());
        assertTrue(response.getContentAsString().contains("\"code\":423"));
        assertEquals(423, run("PUT", "/api/entries/1").getStatus());
    }

    @Test
    void testLockedKeepsReadsAndReconcile() throws Exception {
        assertTrue(statusManager.tryStart());

        assertEquals(200, run("GET", "/api/entries/1").getStatus());
        assertEquals(200, run("OPTIONS", "/api/entries").getStatus());
        assertEquals(200, run("POST", "/api/admin/reconcile").getStatus());
    }

    @Test
    void testStatusManagerIsExclusive() {
        assertTrue(statusManager.tryStart());
        assertFalse(statusManager.tryStart());
        statusManager.finish();
        assertFalse(statusManager.isReconciliationInProgress());
        assertTrue(statusManager.tryStart());
    }
}
