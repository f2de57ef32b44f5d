package com.a2dd.core.logging;

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
    @DisplayName("setSource puts sourceFile in MDC")
    void setSource() {
        MdcContext.setSource("site.yml");
        assertEquals("site.yml", MDC.get("sourceFile"));
    }

    @Test
    @DisplayName("clearTask keeps the source file")
    void clearTask() {
        MdcContext.setSource("site.yml");
        MdcContext.setTask("Install httpd");
        MdcContext.clearTask();
        assertNull(MDC.get("task"));
        assertEquals("site.yml", MDC.get("sourceFile"));
    }

    @Test
    @DisplayName("clear removes all a2dd MDC keys")
    void clear() {
        MdcContext.setSource("site.yml");
        MdcContext.setTask("Install httpd");
        MdcContext.clear();
        assertNull(MDC.get("sourceFile"));
        assertNull(MDC.get("task"));
    }
}
