package io.github.koszti.segmentstore.segment;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IntegrityVerifierTest {

    @Test
    void sha256Hex_matchesKnownDigests() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                IntegrityVerifier.sha256Hex(new byte[0]));
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                IntegrityVerifier.sha256Hex("abc".getBytes(StandardCharsets.US_ASCII)));
    }

    @Test
    void verify_acceptsExactDigestOnly() {
        byte[] data = "segment".getBytes(StandardCharsets.UTF_8);
        String hash = IntegrityVerifier.sha256Hex(data);

        assertTrue(IntegrityVerifier.verify(data, hash));
        assertFalse(IntegrityVerifier.verify(data, hash.toUpperCase()));
        assertFalse(IntegrityVerifier.verify("segment!".getBytes(StandardCharsets.UTF_8), hash));
        assertFalse(IntegrityVerifier.verify(data, null));
        assertFalse(IntegrityVerifier.verify(null, hash));
    }
}
