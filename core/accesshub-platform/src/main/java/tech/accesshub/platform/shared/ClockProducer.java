package tech.accesshub.platform.shared;

import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import java.time.Clock;

/**
 * Exposes the system clock as a bean so expiry checks can be driven by a fixed clock in tests.
 */
public class ClockProducer {

    @Produces
    @Singleton
    Clock clock() {
        return Clock.systemUTC();
    }
}
