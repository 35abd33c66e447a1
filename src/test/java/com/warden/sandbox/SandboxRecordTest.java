package com.warden.sandbox;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SandboxRecordTest {

    @ParameterizedTest
    @ValueSource(strings = {"abc", "t1", "0", "3f2b8c1e-9d4a-4e6b-a1f0-7c5d2e8b9a10"})
    @DisplayName("accepts thread ids that form a DNS label")
    void acceptsLabelSafeIds(String threadId) {
        assertEquals("investigation-" + threadId, SandboxRecord.nameFor(threadId));
    }

    @ParameterizedTest
    @ValueSource(strings = {"abc?dryRun=All&x=", "a,b", "a/b", "ABC", "-abc", "abc-", "a_b", "a.b", "a b", " "})
    @DisplayName("rejects thread ids that could alter API paths or selectors")
    void rejectsUnsafeIds(String threadId) {
        assertThrows(IllegalArgumentException.class, () -> SandboxRecord.nameFor(threadId));
    }

    @Test
    @DisplayName("sandbox names stay within 63 characters")
    void lengthLimit() {
        var longest = "a".repeat(SandboxRecord.MAX_THREAD_ID_LENGTH);

        assertEquals(63, SandboxRecord.nameFor(longest).length());
        assertThrows(IllegalArgumentException.class, () -> SandboxRecord.nameFor(longest + "a"));
        assertThrows(IllegalArgumentException.class, () -> SandboxRecord.nameFor(null));
    }

    @Test
    @DisplayName("toString leaves out the identity token")
    void toStringHidesToken() {
        var record = new SandboxRecord("investigation-t1", "t1", "sandboxes", Instant.EPOCH, "secret-token");

        assertFalse(record.toString().contains("secret-token"));
    }
}
