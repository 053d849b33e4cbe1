// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.registry.discovery;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigInteger;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import sh.sluice.core.error.ExternalUnavailableException;
import sh.sluice.core.model.SwapParameters;
import sh.sluice.core.types.Address;
import sh.sluice.registry.Addresses;
import sh.sluice.registry.spi.GuardedSwapStorage;
import sh.sluice.registry.spi.SwapEngine;

/**
 * Unit tests for {@link SwapStorageVariant} with a mock engine.
 */
@ExtendWith(MockitoExtension.class)
class SwapStorageVariantTest {

    private static final Address TARGET = Addresses.of(0x77);
    private static final Address LP = Addresses.of(0x78);

    private static final SwapParameters STANDARD = new SwapParameters(BigInteger.valueOf(100),
            BigInteger.valueOf(200), BigInteger.valueOf(1), BigInteger.valueOf(2), BigInteger.valueOf(3),
            BigInteger.valueOf(4), LP);

    private static final GuardedSwapStorage GUARDED = new GuardedSwapStorage(BigInteger.valueOf(100),
            BigInteger.valueOf(200), BigInteger.valueOf(1), BigInteger.valueOf(3), BigInteger.valueOf(4), LP);

    @Mock
    private SwapEngine engine;

    @Test
    void standardShapeWins() {
        when(engine.swapStorage()).thenReturn(Optional.of(STANDARD));

        assertEquals(STANDARD, SwapStorageVariant.resolve(engine, TARGET));
        verify(engine, never()).guardedSwapStorage();
    }

    @Test
    void fallsBackToGuardedShape() {
        when(engine.swapStorage()).thenReturn(Optional.empty());
        when(engine.guardedSwapStorage()).thenReturn(Optional.of(GUARDED));

        SwapParameters parameters = SwapStorageVariant.resolve(engine, TARGET);

        assertEquals(BigInteger.valueOf(200), parameters.futureA());
        assertEquals(BigInteger.ZERO, parameters.futureATime());
        assertEquals(BigInteger.valueOf(3), parameters.swapFee());
        assertEquals(LP, parameters.lpToken());
    }

    @Test
    void failingStandardShapeIsSkipped() {
        when(engine.swapStorage()).thenThrow(new UnsupportedOperationException("no such accessor"));
        when(engine.guardedSwapStorage()).thenReturn(Optional.of(GUARDED));

        assertEquals(GUARDED.toSwapParameters(), SwapStorageVariant.resolve(engine, TARGET));
    }

    @Test
    void noShapeAnswers() {
        when(engine.swapStorage()).thenReturn(Optional.empty());
        when(engine.guardedSwapStorage()).thenReturn(Optional.empty());

        ExternalUnavailableException ex = assertThrows(ExternalUnavailableException.class,
                () -> SwapStorageVariant.resolve(engine, TARGET));
        assertEquals(ExternalUnavailableException.Reason.NO_PARAMETER_DATA, ex.reason());
        assertNull(ex.getCause());
    }

    @Test
    void lastFailureBecomesCause() {
        RuntimeException last = new UnsupportedOperationException("guarded read failed");
        when(engine.swapStorage()).thenThrow(new IllegalArgumentException("standard read failed"));
        when(engine.guardedSwapStorage()).thenThrow(last);

        ExternalUnavailableException ex = assertThrows(ExternalUnavailableException.class,
                () -> SwapStorageVariant.resolve(engine, TARGET));
        assertSame(last, ex.getCause());
    }

    @Test
    void rejectedNestedWritePropagates() {
        IllegalStateException rejected = new IllegalStateException("reentrant write into pool registry rejected");
        when(engine.swapStorage()).thenThrow(rejected);

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> SwapStorageVariant.resolve(engine, TARGET));
        assertSame(rejected, ex);
        verify(engine, never()).guardedSwapStorage();
    }
}
