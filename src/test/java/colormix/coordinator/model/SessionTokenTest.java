package colormix.coordinator.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SessionTokenTest {

    @Test
    void matchesBothIds() {
        SessionToken token = new SessionToken("s1", "abcd1234");

        assertTrue(token.matches("s1", "abcd1234"));
        assertFalse(token.matches("s1", "ffff0000"));
        assertFalse(token.matches("s2", "abcd1234"));
        assertFalse(token.matches(null, "abcd1234"));
        assertFalse(token.matches("s1", null));
    }

    @Test
    void rejectsBlankIds() {
        assertThrows(IllegalArgumentException.class, () -> new SessionToken("", "abcd1234"));
        assertThrows(IllegalArgumentException.class, () -> new SessionToken("s1", " "));
        assertThrows(IllegalArgumentException.class, () -> new SessionToken(null, "abcd1234"));
    }

    @Test
    void printsAsPath() {
        assertEquals("s1/abcd1234", new SessionToken("s1", "abcd1234").toString());
    }
}
