// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.core;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

class LogFormatterTest {

    private static final String POOL = "0x1234567890abcdef1234567890abcdef12345678";

    @Test
    void shortensLongIdentifiers() {
        assertEquals("0x1234...5678", LogFormatter.shorten(POOL));
        assertEquals("0x12", LogFormatter.shorten("0x12"));
        assertEquals("null", LogFormatter.shorten(null));
    }

    @Test
    void poolAddedLine() {
        String line = LogFormatter.formatPoolAdded(POOL, 0, 3, 0);
        assertTrue(line.contains("[POOL-ADD]"));
        assertTrue(line.contains("pool=0x1234...5678"));
        assertTrue(line.contains("tokens=3"));
    }

    @Test
    void probeWithoutResult() {
        String line = LogFormatter.formatProbe("token", POOL, 3, null);
        assertTrue(line.contains("[PROBE]"));
        assertTrue(line.contains("index=3"));
        assertTrue(line.contains("result=none"));
    }

    @Test
    void discoveredListsShortenedTokens() {
        String line = LogFormatter.formatDiscovered(POOL, List.of(POOL, POOL));
        assertTrue(line.contains("tokens=[0x1234...5678, 0x1234...5678]"));
    }

    @Test
    void registryAddedLine() {
        String line = LogFormatter.formatRegistryAdded("PoolRegistry", POOL, 2);
        assertTrue(line.contains("[REGISTRY-ADD]"));
        assertTrue(line.contains("name=PoolRegistry"));
        assertTrue(line.contains("version=2"));
    }
}
