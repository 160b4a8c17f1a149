package io.vaultclient.sdk.auth;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StaticTokenProviderTest {

    @Test
    void returnsTrimmedToken() {
        StaticTokenProvider provider = new StaticTokenProvider(" s.token ");

        assertEquals("s.token", provider.token());
        provider.invalidate();
        assertEquals("s.token", provider.token());
    }

    @Test
    void rejectsBlankToken() {
        assertThrows(IllegalArgumentException.class, () -> new StaticTokenProvider(""));
        assertThrows(IllegalArgumentException.class, () -> new StaticTokenProvider(null));
    }

    @Test
    void doesNotLeakTokenInToString() {
        assertFalse(new StaticTokenProvider("s.secret").toString().contains("s.secret"));
    }
}
