package org.sandpile.runtime;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class ConfigTest {

    @Test
    void frameFileNamesArePaddedToEightDigits() {
        assertEquals("00000000.png", Config.frameFileName(0));
        assertEquals("00000042.png", Config.frameFileName(42));
        assertEquals("99999999.png", Config.frameFileName(99_999_999));
    }

    @Test
    void paddedNamesSortLikeTheirIndices() {
        assertTrue(Config.frameFileName(9).compareTo(Config.frameFileName(10)) < 0);
        assertTrue(Config.frameFileName(999).compareTo(Config.frameFileName(1000)) < 0);
    }

    @Test
    void negativeIndexIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Config.frameFileName(-1));
    }
}
