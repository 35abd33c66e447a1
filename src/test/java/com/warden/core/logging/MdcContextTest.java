package com.warden.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("setSandbox populates thread and sandbox keys")
    void setSandbox() {
        MdcContext.setSandbox("t1", "investigation-t1");

        assertEquals("t1", MDC.get("threadId"));
        assertEquals("investigation-t1", MDC.get("sandboxName"));
    }

    @Test
    @DisplayName("clear removes only Warden keys")
    void clearLeavesOtherKeys() {
        MDC.put("requestId", "r-1");
        MdcContext.setSandbox("t1", "investigation-t1");

        MdcContext.clear();

        assertNull(MDC.get("threadId"));
        assertNull(MDC.get("sandboxName"));
        assertEquals("r-1", MDC.get("requestId"));
    }
}
