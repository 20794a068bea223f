package com.demo.policy.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import org.junit.jupiter.api.Test;

class FingerprintGeneratorTest {

    private final FingerprintGenerator generator = new FingerprintGenerator(8);

    private static EnvironmentSignals desktop() {
        return new EnvironmentSignals("Mozilla/5.0 (X11; Linux x86_64)", "en-US", 1920, 1080, -480,
                "data:image/png;base64,AAAA", 8, 0);
    }

    @Test
    void generate_hashesSignalsInFixedOrder() {
        assertEquals("31d73c9b", generator.generate(desktop()));
    }

    @Test
    void generate_isStableForSameEnvironment() {
        assertEquals(generator.generate(desktop()), generator.generate(desktop()));
    }

    @Test
    void generate_changesWhenAnySignalChanges() {
        String base = generator.generate(desktop());

        assertNotEquals(base, generator.generate(new EnvironmentSignals("Mozilla/5.0 (X11; Linux x86_64)", "zh-CN",
                1920, 1080, -480, "data:image/png;base64,AAAA", 8, 0)));
        assertNotEquals(base, generator.generate(new EnvironmentSignals("Mozilla/5.0 (X11; Linux x86_64)", "en-US",
                1280, 720, -480, "data:image/png;base64,AAAA", 8, 0)));
        assertNotEquals(base, generator.generate(new EnvironmentSignals("Mozilla/5.0 (X11; Linux x86_64)", "en-US",
                1920, 1080, -480, "data:image/png;base64,AAAA", 8, 5)));
    }

    @Test
    void generate_toleratesMissingTextSignals() {
        EnvironmentSignals bare = new EnvironmentSignals(null, null, 0, 0, 0, null, 0, 0);
        assertEquals(8, generator.generate(bare).length());
    }
}
