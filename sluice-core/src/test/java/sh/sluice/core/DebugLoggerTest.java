// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class DebugLoggerTest {

    private final Logger logger = (Logger) LoggerFactory.getLogger("sh.sluice.debug");
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void attach() {
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void reset() {
        SluiceDebug.setEnabled(false);
        logger.detachAndStopAllAppenders();
    }

    @Test
    void doesNotLogWhenDisabled() {
        DebugLogger.logWrite("should not appear");
        DebugLogger.logProbe("should not appear");

        assertTrue(appender.list.isEmpty());
    }

    @Test
    void probeToggleIsIndependentOfWriteToggle() {
        SluiceDebug.setWriteLogging(true);

        DebugLogger.logProbe("probe %d", 1);
        DebugLogger.logWrite("write %d", 2);

        assertEquals(1, appender.list.size());
        assertEquals("write 2", appender.list.get(0).getFormattedMessage());
    }

    @Test
    void setEnabledSwitchesBothToggles() {
        SluiceDebug.setEnabled(true);
        DebugLogger.logWrite("write");
        DebugLogger.logProbe("probe");
        assertEquals(2, appender.list.size());

        SluiceDebug.setEnabled(false);
        DebugLogger.logWrite("write");
        assertEquals(2, appender.list.size());
    }
}
