package org.waabox.vecino.client.websocket;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;

import org.junit.jupiter.api.Test;
import org.waabox.vecino.event.ListingDeleted;
import org.waabox.vecino.event.UsersCount;

/**
 * Tests for {@link FrameListener}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class FrameListenerTest {

  @Test
  void whenReceivingText_givenCompleteFrame_shouldDispatchEvent() {
    final WebSocket webSocket = createMock(WebSocket.class);
    webSocket.request(1);
    expectLastCall().times(2);
    replay(webSocket);

    final RecordingTransportListener listener =
        new RecordingTransportListener();
    final FrameListener frames = new FrameListener(listener);

    frames.onOpen(webSocket);
    frames.onText(webSocket, "{\"event\":\"users-count\",\"data\":3}", true);

    verify(webSocket);
    assertEquals(1, listener.events.size());
    assertEquals(new UsersCount(3), listener.events.get(0));
  }

  @Test
  void whenReceivingText_givenFrameSplitInParts_shouldJoinThem() {
    final WebSocket webSocket = createMock(WebSocket.class);
    webSocket.request(1);
    expectLastCall().times(3);
    replay(webSocket);

    final RecordingTransportListener listener =
        new RecordingTransportListener();
    final FrameListener frames = new FrameListener(listener);

    frames.onText(webSocket, "{\"event\":\"listing-del", false);
    frames.onText(webSocket, "eted\",\"data\":", false);
    frames.onText(webSocket, "\"l-1\"}", true);

    verify(webSocket);
    assertEquals(1, listener.events.size());
    assertInstanceOf(ListingDeleted.class, listener.events.get(0));
    assertEquals("l-1",
        ((ListingDeleted) listener.events.get(0)).listingId());
  }

  @Test
  void whenReceivingText_givenMalformedFrame_shouldDropItAndKeepReading() {
    final WebSocket webSocket = createMock(WebSocket.class);
    webSocket.request(1);
    expectLastCall().times(2);
    replay(webSocket);

    final RecordingTransportListener listener =
        new RecordingTransportListener();
    final FrameListener frames = new FrameListener(listener);

    frames.onText(webSocket, "{\"event\":\"unknown\",\"data\":1}", true);
    frames.onText(webSocket, "{\"event\":\"users-count\",\"data\":1}", true);

    verify(webSocket);
    assertEquals(1, listener.events.size());
    assertTrue(listener.errors.isEmpty());
  }

  @Test
  void whenReceivingBinary_givenAnyPayload_shouldIgnoreIt() {
    final WebSocket webSocket = createMock(WebSocket.class);
    webSocket.request(1);
    expectLastCall().once();
    replay(webSocket);

    final RecordingTransportListener listener =
        new RecordingTransportListener();
    new FrameListener(listener).onBinary(webSocket,
        ByteBuffer.wrap(new byte[] {1, 2}), true);

    verify(webSocket);
    assertTrue(listener.events.isEmpty());
  }

  @Test
  void whenClosingAndFailing_givenCallbacks_shouldForwardThem() {
    final WebSocket webSocket = createMock(WebSocket.class);
    replay(webSocket);

    final RecordingTransportListener listener =
        new RecordingTransportListener();
    final FrameListener frames = new FrameListener(listener);
    final IOException failure = new IOException("reset");

    frames.onClose(webSocket, 1001, "going away");
    frames.onError(webSocket, failure);

    assertEquals("closed with status 1001: going away",
        listener.closings.get(0));
    assertSame(failure, listener.errors.get(0));
  }
}
