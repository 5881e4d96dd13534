package com.questrail.sequencer.exec;

import com.questrail.sequencer.api.ErrorCategory;
import com.questrail.sequencer.error.SequenceCancelledException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {

    @Test
    void cancelIsObservedAndResetClearsIt() {
        CancellationToken token = new CancellationToken();
        token.cancel("stop");

        assertTrue(token.isCancelled());
        assertEquals("stop", token.reason());
        assertEquals(ErrorCategory.CANCELLED, token.cause());
        assertThrows(SequenceCancelledException.class, token::throwIfCancelled);

        token.reset();
        assertFalse(token.isCancelled());
        assertDoesNotThrow(token::throwIfCancelled);
    }

    @Test
    void staleGenerationCannotCancelNextRun() {
        CancellationToken token = new CancellationToken();
        long first = token.reset();
        long second = token.reset();

        assertFalse(token.cancel(first, ErrorCategory.TIMEOUT, "late timeout"));
        assertFalse(token.isCancelled());

        assertTrue(token.cancel(second, ErrorCategory.TIMEOUT, "timed out"));
        assertEquals(ErrorCategory.TIMEOUT, token.cause());
    }

    @Test
    void firstCauseWins() {
        CancellationToken token = new CancellationToken();
        long gen = token.reset();
        token.cancel("user");

        assertFalse(token.cancel(gen, ErrorCategory.TIMEOUT, "timed out"));
        assertEquals(ErrorCategory.CANCELLED, token.cause());
        assertEquals("user", token.reason());
    }

    @Test
    void awaitCancellationWakesOnCancel() throws Exception {
        CancellationToken token = new CancellationToken();
        Thread t = new Thread(() -> {
            try {
                Thread.sleep(30);
            } catch (InterruptedException ignored) {
                Thread.currentThread().interrupt();
            }
            token.cancel();
        });
        long start = System.nanoTime();
        t.start();

        assertTrue(token.awaitCancellation(Duration.ofSeconds(5)));
        assertTrue(Duration.ofNanos(System.nanoTime() - start).toMillis() < 2000);
        t.join();
    }

    @Test
    void awaitCancellationTimesOut() {
        assertFalse(new CancellationToken().awaitCancellation(Duration.ofMillis(10)));
    }
}
