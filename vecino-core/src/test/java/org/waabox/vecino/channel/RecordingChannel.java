package org.waabox.vecino.channel;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import org.waabox.vecino.TransportException;
import org.waabox.vecino.event.SyncEvent;

/**
 * A {@link SyncChannel} that records what is sent over it.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RecordingChannel implements SyncChannel {

  /** The channel id. */
  private final String id;

  /** The sent events, in send order. */
  private final List<SyncEvent> sent = new CopyOnWriteArrayList<>();

  /** Whether the channel is open. */
  private volatile boolean open = true;

  /** Whether sends must fail. */
  private volatile boolean failSends = false;

  /** Creates an open channel.
   *
   * @param theId the channel id.
   */
  public RecordingChannel(final String theId) {
    id = theId;
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public CompletableFuture<Void> send(final SyncEvent event) {
    if (!open || failSends) {
      return CompletableFuture.failedFuture(
          new TransportException("Channel " + id + " cannot send"));
    }
    sent.add(event);
    return CompletableFuture.completedFuture(null);
  }

  @Override
  public boolean isOpen() {
    return open;
  }

  @Override
  public void close() {
    open = false;
  }

  /** Makes every following send fail or succeed.
   *
   * @param fail true to fail sends.
   */
  public void failSends(final boolean fail) {
    failSends = fail;
  }

  /** Returns every sent event.
   *
   * @return the events in send order.
   */
  public List<SyncEvent> sent() {
    return List.copyOf(sent);
  }

  /** Returns the sent events of the given type.
   *
   * @param <T> the event type.
   * @param type the event class.
   * @return the matching events in send order.
   */
  public <T extends SyncEvent> List<T> sent(final Class<T> type) {
    return sent.stream()
        .filter(type::isInstance)
        .map(type::cast)
        .collect(Collectors.toList());
  }

  /** Forgets the recorded events. */
  public void clear() {
    sent.clear();
  }
}
