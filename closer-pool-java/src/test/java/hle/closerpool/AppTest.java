package hle.closerpool;

import hle.closerpool.pool.PoolBackend;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AppTest {

    @Test
    void shouldParseOptions() {
        Map<String, String> options = App.parseArgs(
                new String[] {"--workers", "5", "--backend", "commons-pool2"});

        assertEquals(5, App.getIntOption(options, "workers", 25));
        assertEquals(2, App.getIntOption(options, "capacity", 2));
        assertEquals(PoolBackend.COMMONS_POOL2, App.getBackendOption(options));
    }

    @Test
    void shouldDefaultToBoundedBackend() {
        assertEquals(PoolBackend.BOUNDED, App.getBackendOption(Collections.emptyMap()));
    }

    @Test
    void shouldRejectMalformedArguments() {
        assertThrows(IllegalArgumentException.class, () -> App.parseArgs(new String[] {"workers"}));
        assertThrows(IllegalArgumentException.class, () -> App.parseArgs(new String[] {"--workers"}));
        assertThrows(IllegalArgumentException.class,
                () -> App.getIntOption(Map.of("workers", "many"), "workers", 1));
        assertThrows(IllegalArgumentException.class,
                () -> App.getBackendOption(Map.of("backend", "hikari")));
    }

    @Test
    void shouldRecognizeHelp() {
        assertTrue(App.parseArgs(new String[] {"-h"}).containsKey("help"));
    }
}
