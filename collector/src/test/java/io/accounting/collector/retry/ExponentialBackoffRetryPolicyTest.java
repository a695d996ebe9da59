package io.accounting.collector.retry;

import io.accounting.error.NotFoundException;
import io.accounting.error.UpstreamUnavailableException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ExponentialBackoffRetryPolicyTest {
    @Test
    void doubles_delay_up_to_cap() {
        var p = new ExponentialBackoffRetryPolicy(5, 1000, 5000);
        assertEquals(1000, p.backoffMillis(1));
        assertEquals(2000, p.backoffMillis(2));
        assertEquals(4000, p.backoffMillis(3));
        assertEquals(5000, p.backoffMillis(4));
        assertEquals(5000, p.backoffMillis(60));
    }

    @Test
    void unavailable_store_is_retried_forever() {
        var p = new ExponentialBackoffRetryPolicy(3, 10, 100);
        assertTrue(p.shouldRetry(1_000, new UpstreamUnavailableException("down")));
    }

    @Test
    void other_failures_give_up_after_max_attempts() {
        var p = new ExponentialBackoffRetryPolicy(3, 10, 100);
        assertTrue(p.shouldRetry(2, new NotFoundException("missing")));
        assertFalse(p.shouldRetry(3, new NotFoundException("missing")));
    }
}
