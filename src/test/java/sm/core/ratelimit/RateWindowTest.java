package sm.core.ratelimit;

import org.junit.jupiter.api.Test;
import sm.core.model.WindowKind;

import static org.junit.jupiter.api.Assertions.*;

class RateWindowTest {

    private static final long SECOND = 1_000_000_000L;

    @Test
    void withinWindow_countsExactly() {
        RateWindow window = new RateWindow(WindowKind.MINUTE, SECOND, 2);

        window.reserve(0);
        window.reserve(0);
        assertFalse(window.hasCapacity(0));
        assertEquals(SECOND, window.nanosUntilFree(0));
        assertThrows(IllegalStateException.class, () -> window.reserve(0));

        assertEquals(0L, window.nanosUntilFree(SECOND));
        assertTrue(window.hasCapacity(SECOND));
    }

    @Test
    void slidingWindow_freesOldestFirst() {
        RateWindow window = new RateWindow(WindowKind.MINUTE, SECOND, 2);

        window.reserve(0);
        window.reserve(400_000_000L);

        assertEquals(600_000_000L, window.nanosUntilFree(400_000_000L));
        assertEquals(0, window.remaining(SECOND - 1));
        assertEquals(1, window.remaining(SECOND));
    }

    @Test
    void saturation_reportsFullUntilDeadline() {
        RateWindow window = new RateWindow(WindowKind.MINUTE, SECOND, 5);

        window.saturateUntil(3 * SECOND);

        assertEquals(0, window.remaining(0));
        assertEquals(3 * SECOND, window.nanosUntilFree(0));
        assertEquals(5, window.remaining(3 * SECOND));
    }

    @Test
    void saturation_neverShortened() {
        RateWindow window = new RateWindow(WindowKind.MINUTE, SECOND, 5);

        window.saturateUntil(3 * SECOND);
        window.saturateUntil(SECOND);

        assertEquals(2 * SECOND, window.nanosUntilFree(SECOND));
    }

    @Test
    void naturalRelease_emptyLogIsOneWindowAhead() {
        RateWindow window = new RateWindow(WindowKind.MINUTE, SECOND, 5);
        assertEquals(7 + SECOND, window.naturalReleaseNanos(7));

        window.reserve(10);
        assertEquals(10 + SECOND, window.naturalReleaseNanos(20));
    }

    @Test
    void invalidLimit() {
        assertThrows(IllegalArgumentException.class, () -> new RateWindow(WindowKind.DAY, 0));
    }
}
