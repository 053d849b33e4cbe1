// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.registry.internal;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.Test;

class WriteGuardTest {

    private final WriteGuard guard = new WriteGuard("test registry");
    private int counter;

    @Test
    void nestedWriteIsRejected() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> guard.write(() -> guard.write(() -> 1)));
        assertTrue(ex.getMessage().contains("test registry"));

        // the outer write released its lock
        assertEquals(2, guard.write(() -> 2));
    }

    @Test
    void readInsideWriteIsAllowed() {
        assertEquals("inner", guard.write(() -> guard.read(() -> "inner")));
    }

    @Test
    void failingActionReleasesLock() {
        assertThrows(IllegalArgumentException.class, () -> guard.write(() -> {
            throw new IllegalArgumentException("boom");
        }));
        assertEquals(1, guard.write(() -> 1));
    }

    @Test
    void writesAreSerialised() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 1_000; i++) {
                        guard.write(() -> counter++);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(4_000, guard.read(() -> counter));
    }
}
