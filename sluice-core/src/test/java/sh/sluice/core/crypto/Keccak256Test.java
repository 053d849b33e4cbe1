// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sluice.core.crypto;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import sh.sluice.primitives.Hex;

class Keccak256Test {

    @Test
    void hashesEmptyInput() {
        assertEquals(
                "0xc5d2460186f7233c927e7db2dcc703c0e500b653ca82273b7bfad8045d85a470",
                Hex.encode(Keccak256.hash(new byte[0])));
    }

    @Test
    void hashesKnownVector() {
        assertEquals(
                "0x1c8aff950685c2ed4bc3174f3472287b56d9517b9c948127319a09a7a36deac8",
                Hex.encode(Keccak256.hash("hello".getBytes(StandardCharsets.UTF_8))));
    }

    @Test
    void multipleInputsHashAsConcatenation() {
        byte[] hello = "hel".getBytes(StandardCharsets.UTF_8);
        byte[] lo = "lo".getBytes(StandardCharsets.UTF_8);
        assertArrayEquals(
                Keccak256.hash("hello".getBytes(StandardCharsets.UTF_8)),
                Keccak256.hash(hello, lo));
    }

    @Test
    void rejectsNullElement() {
        assertThrows(NullPointerException.class, () -> Keccak256.hash(new byte[1], null));
    }

    @Test
    void cleanupIsIdempotent() {
        Keccak256.cleanup();
        Keccak256.cleanup();
        assertEquals(32, Keccak256.hash(new byte[0]).length);
    }
}
