package org.waabox.vecino.server;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link PresenceTracker}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class PresenceTrackerTest {

  @Test
  void whenConnectingAndDisconnecting_shouldTrackOpenChannels() {
    final PresenceTracker tracker = new PresenceTracker();

    assertEquals(0, tracker.count());
    assertEquals(1, tracker.connected());
    assertEquals(2, tracker.connected());
    assertEquals(1, tracker.disconnected());
    assertEquals(1, tracker.count());
  }

  @Test
  void whenDisconnecting_givenZeroCount_shouldStayAtZero() {
    final PresenceTracker tracker = new PresenceTracker();

    assertEquals(0, tracker.disconnected());
    assertEquals(0, tracker.count());
  }
}
