package com.frameception.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setProject puts projectId in MDC")
    void setProject() {
        MdcContext.setProject("p-1");
        assertEquals("p-1", MDC.get("projectId"));
    }

    @Test
    @DisplayName("setProject with null removes the key")
    void setProjectNull() {
        MdcContext.setProject("p-1");
        MdcContext.setProject(null);
        assertNull(MDC.get("projectId"));
    }

    @Test
    @DisplayName("setAction puts projectId and action in MDC")
    void setAction() {
        MdcContext.setAction("p-1", "deploy");
        assertEquals("p-1", MDC.get("projectId"));
        assertEquals("deploy", MDC.get("action"));
    }

    @Test
    @DisplayName("clear removes dashboard keys only")
    void clear() {
        MDC.put("other", "kept");
        MdcContext.setAction("p-1", "update");

        MdcContext.clear();

        assertNull(MDC.get("projectId"));
        assertNull(MDC.get("action"));
        assertEquals("kept", MDC.get("other"));
        MDC.remove("other");
    }
}
