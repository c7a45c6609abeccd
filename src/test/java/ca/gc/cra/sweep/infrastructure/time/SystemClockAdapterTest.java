package ca.gc.cra.sweep.infrastructure.time;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class SystemClockAdapterTest {
  @Test
  void delegatesToTheSuppliedClock() {
    Instant fixed = Instant.parse("2026-02-10T08:15:00.250Z");
    SystemClockAdapter clock = new SystemClockAdapter(Clock.fixed(fixed, ZoneOffset.UTC));

    assertEquals(fixed.toEpochMilli(), clock.nowMillis());
    assertEquals(fixed, clock.now());
  }
}
