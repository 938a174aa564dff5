package com.github.liyibo1110.pantry.cache;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class PantrySpecTest {

    @Test
    public void testParseAllOptions() {
        PantrySpec spec = PantrySpec.parse("ttl=10m, maximumSize=500, resetTtlOnGet, revalidateOnGet, recordStats");
        Cache<String, String> cache = Pantry.<String, String>from(spec).build();
        Policy<String, String> policy = cache.policy();

        assertEquals(Duration.ofMinutes(10), policy.ttl());
        assertEquals(500L, policy.maximumSize().getAsLong());
        assertTrue(policy.isResetTtlOnGet());
        assertTrue(policy.isRevalidateOnGet());
        assertTrue(policy.isRecordingStats());
    }

    @Test
    public void testDurationFormats() {
        assertEquals(Duration.ofMillis(250), PantrySpec.parseDuration("ttl", "250ms"));
        assertEquals(Duration.ofSeconds(30), PantrySpec.parseDuration("ttl", "30s"));
        assertEquals(Duration.ofHours(2), PantrySpec.parseDuration("ttl", "2h"));
        assertEquals(Duration.ofDays(1), PantrySpec.parseDuration("ttl", "1d"));
        assertEquals(Duration.ofMinutes(90), PantrySpec.parseDuration("ttl", "PT1H30M"));
    }

    @Test
    public void testInvalidSpecifications() {
        assertThrows(IllegalArgumentException.class, () -> PantrySpec.parse("ttl=10x"));
        assertThrows(IllegalArgumentException.class, () -> PantrySpec.parse("ttl=-5s"));
        assertThrows(IllegalArgumentException.class, () -> PantrySpec.parse("ttl="));
        assertThrows(IllegalArgumentException.class, () -> PantrySpec.parse("ttl=1s,ttl=2s"));
        assertThrows(IllegalArgumentException.class, () -> PantrySpec.parse("maximumSize=many"));
        assertThrows(IllegalArgumentException.class, () -> PantrySpec.parse("resetTtlOnGet=true"));
        assertThrows(IllegalArgumentException.class, () -> PantrySpec.parse("ttl=1s=2s"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> PantrySpec.parse("weakKeys"));
        assertEquals("Unknown key weakKeys", e.getMessage());
    }

    @Test
    public void testMissingTtlFailsAtBuild() {
        Pantry<String, String> builder = Pantry.from("maximumSize=10");
        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    public void testEqualityIgnoresFormatting() {
        PantrySpec compact = PantrySpec.parse("ttl=60s,maximumSize=5");
        PantrySpec spaced = PantrySpec.parse(" maximumSize = 5 , ttl = 1m ");

        assertEquals(compact, spaced);
        assertEquals(compact.hashCode(), spaced.hashCode());
        assertEquals("ttl=60s,maximumSize=5", compact.toParsableString());
        assertNotEquals(compact, PantrySpec.parse("ttl=60s"));
    }
}
