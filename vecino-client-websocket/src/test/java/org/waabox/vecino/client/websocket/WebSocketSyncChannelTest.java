package org.waabox.vecino.client.websocket;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.capture;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.newCapture;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.http.WebSocket;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import org.easymock.Capture;
import org.easymock.CaptureType;
import org.junit.jupiter.api.Test;
import org.waabox.vecino.TransportException;
import org.waabox.vecino.event.ListingDeleted;
import org.waabox.vecino.event.SyncListings;

/**
 * Tests for {@link WebSocketSyncChannel}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class WebSocketSyncChannelTest {

  @Test
  void whenSending_givenOpenSocket_shouldWriteEncodedFrame()
      throws Exception {

    final WebSocket webSocket = createMock(WebSocket.class);
    final Capture<CharSequence> frame = newCapture();

    expect(webSocket.isOutputClosed()).andReturn(false).anyTimes();
    expect(webSocket.isInputClosed()).andReturn(false).anyTimes();
    expect(webSocket.sendText(capture(frame), eq(true)))
        .andReturn(CompletableFuture.completedFuture(webSocket));
    replay(webSocket);

    final WebSocketSyncChannel channel = new WebSocketSyncChannel(webSocket);
    channel.send(new SyncListings(List.of())).get();

    verify(webSocket);
    assertEquals("{\"event\":\"sync-listings\",\"data\":[]}",
        frame.getValue().toString());
    assertTrue(channel.id().startsWith("ws-"));
  }

  @Test
  void whenSending_givenPreviousSendPending_shouldWaitForIt() {

    final WebSocket webSocket = createMock(WebSocket.class);
    final Capture<CharSequence> frames = newCapture(CaptureType.ALL);
    final CompletableFuture<WebSocket> firstWrite = new CompletableFuture<>();

    expect(webSocket.isOutputClosed()).andReturn(false).anyTimes();
    expect(webSocket.isInputClosed()).andReturn(false).anyTimes();
    expect(webSocket.sendText(capture(frames), eq(true)))
        .andReturn(firstWrite);
    expect(webSocket.sendText(capture(frames), eq(true)))
        .andReturn(CompletableFuture.completedFuture(webSocket));
    replay(webSocket);

    final WebSocketSyncChannel channel = new WebSocketSyncChannel(webSocket);
    final CompletableFuture<Void> first =
        channel.send(new ListingDeleted("a"));
    final CompletableFuture<Void> second =
        channel.send(new ListingDeleted("b"));

    assertEquals(1, frames.getValues().size());
    assertFalse(second.isDone());

    firstWrite.complete(webSocket);

    verify(webSocket);
    assertTrue(first.isDone());
    assertTrue(second.isDone());
    assertTrue(frames.getValues().get(1).toString().contains("\"b\""));
  }

  @Test
  void whenSending_givenWriteFailure_shouldFailWithTransportException() {

    final WebSocket webSocket = createMock(WebSocket.class);

    expect(webSocket.isOutputClosed()).andReturn(false).anyTimes();
    expect(webSocket.isInputClosed()).andReturn(false).anyTimes();
    expect(webSocket.sendText(anyObject(CharSequence.class), eq(true)))
        .andReturn(CompletableFuture.failedFuture(new IOException("broken")));
    replay(webSocket);

    final CompletableFuture<Void> sent = new WebSocketSyncChannel(webSocket)
        .send(new ListingDeleted("a"));

    final ExecutionException error =
        assertThrows(ExecutionException.class, sent::get);
    assertInstanceOf(TransportException.class, error.getCause());
    assertInstanceOf(IOException.class, error.getCause().getCause());
  }

  @Test
  void whenSending_givenClosedSocket_shouldFailWithoutWriting() {

    final WebSocket webSocket = createMock(WebSocket.class);

    expect(webSocket.isOutputClosed()).andReturn(true).anyTimes();
    expect(webSocket.isInputClosed()).andReturn(false).anyTimes();
    replay(webSocket);

    final WebSocketSyncChannel channel = new WebSocketSyncChannel(webSocket);

    assertFalse(channel.isOpen());
    final ExecutionException error = assertThrows(ExecutionException.class,
        () -> channel.send(new ListingDeleted("a")).get());
    assertInstanceOf(TransportException.class, error.getCause());
    verify(webSocket);
  }

  @Test
  void whenClosing_givenCloseHandshakeFailure_shouldAbort() {

    final WebSocket webSocket = createMock(WebSocket.class);

    expect(webSocket.isOutputClosed()).andReturn(false);
    expect(webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "client closing"))
        .andReturn(CompletableFuture.failedFuture(new IOException("gone")));
    webSocket.abort();
    replay(webSocket);

    new WebSocketSyncChannel(webSocket).close();

    verify(webSocket);
  }

  @Test
  void whenClosing_givenAlreadyClosedOutput_shouldDoNothing() {

    final WebSocket webSocket = createMock(WebSocket.class);

    expect(webSocket.isOutputClosed()).andReturn(true);
    replay(webSocket);

    new WebSocketSyncChannel(webSocket).close();

    verify(webSocket);
  }
}
