package io.instiflow.budget;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class RequestPacerTest {
    @Test
    void spaces_successive_requests() throws Exception {
        RequestPacer pacer = new RequestPacer(Duration.ofMillis(100));
        pacer.acquire();
        long t1 = System.nanoTime();
        pacer.acquire();
        long t2 = System.nanoTime();
        long dt = (t2 - t1) / 1_000_000;
        // some slack for slow CI clocks
        assertTrue(dt >= 60, "expected spacing >= 60ms but was " + dt + "ms");
    }

    @Test
    void first_request_does_not_wait() throws Exception {
        RequestPacer pacer = new RequestPacer(Duration.ofSeconds(5));
        long t0 = System.nanoTime();
        pacer.acquire();
        assertTrue((System.nanoTime() - t0) / 1_000_000 < 1000);
    }

    @Test
    void unpaced_never_waits() throws Exception {
        RequestPacer pacer = RequestPacer.unpaced();
        long t0 = System.nanoTime();
        for (int i = 0; i < 100; i++) pacer.acquire();
        assertTrue((System.nanoTime() - t0) / 1_000_000 < 1000);
        assertEquals(Duration.ZERO, pacer.interval());
    }
}
