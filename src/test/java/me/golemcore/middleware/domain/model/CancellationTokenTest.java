package me.golemcore.middleware.domain.model;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CancellationTokenTest {

    @Test
    void shouldRunListenersOnceOnCancel() {
        CancellationToken token = CancellationToken.create();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);

        token.cancel();
        token.cancel();

        assertTrue(token.isCancelled());
        assertEquals(1, calls.get());
    }

    @Test
    void shouldRunLateListenerImmediately() {
        CancellationToken token = CancellationToken.create();
        token.cancel();
        AtomicInteger calls = new AtomicInteger();

        token.onCancel(calls::incrementAndGet);

        assertEquals(1, calls.get());
    }

    @Test
    void shouldNotRunRemovedListener() {
        CancellationToken token = CancellationToken.create();
        AtomicInteger calls = new AtomicInteger();
        Runnable remove = token.onCancel(calls::incrementAndGet);

        remove.run();
        token.cancel();

        assertEquals(0, calls.get());
    }

    @Test
    void shouldKeepOtherListenersRunningWhenOneFails() {
        CancellationToken token = CancellationToken.create();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        token.onCancel(calls::incrementAndGet);

        token.cancel();

        assertEquals(1, calls.get());
    }

    @Test
    void shouldRefuseToCancelSharedNoneToken() {
        CancellationToken none = CancellationToken.none();

        assertThrows(IllegalStateException.class, none::cancel);
        assertFalse(none.isCancelled());
    }
}
