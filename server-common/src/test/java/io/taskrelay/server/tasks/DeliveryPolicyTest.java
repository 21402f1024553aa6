package io.taskrelay.server.tasks;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;

import org.junit.jupiter.api.Test;

public class DeliveryPolicyTest {

    @Test
    public void testBackoffGrowsAndIsCapped() {
        DeliveryPolicy policy = new DeliveryPolicy(6, Duration.ofMillis(100), 2.0, Duration.ofMillis(500),
                Duration.ofSeconds(1));

        assertEquals(Duration.ofMillis(100), policy.backoffAfter(1));
        assertEquals(Duration.ofMillis(200), policy.backoffAfter(2));
        assertEquals(Duration.ofMillis(400), policy.backoffAfter(3));
        assertEquals(Duration.ofMillis(500), policy.backoffAfter(4));
        assertEquals(Duration.ofMillis(500), policy.backoffAfter(10));
    }

    @Test
    public void testRejectsInvalidSchedules() {
        assertThrows(IllegalArgumentException.class,
                () -> new DeliveryPolicy(0, Duration.ofMillis(1), 2.0, Duration.ofMillis(1), Duration.ofMillis(1)));
        assertThrows(IllegalArgumentException.class,
                () -> new DeliveryPolicy(1, Duration.ofMillis(1), 0.5, Duration.ofMillis(1), Duration.ofMillis(1)));
        assertThrows(IllegalArgumentException.class,
                () -> new DeliveryPolicy(1, null, 2.0, Duration.ofMillis(1), Duration.ofMillis(1)));
    }
}
