package org.waabox.vecino.server;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.vecino.channel.SyncChannel;
import org.waabox.vecino.event.SyncEvent;

/**
 * The set of client channels connected to the server.
 *
 * <p>Broadcasts hand the event to every registered channel without waiting
 * for the sends to complete. A failed send is logged and does not affect
 * the other channels.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ChannelGroup {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      ChannelGroup.class);

  /** The registered channels by id. */
  private final Map<String, SyncChannel> channels = new ConcurrentHashMap<>();

  /**
   * Registers a channel.
   *
   * @param channel the channel, never null
   * @return true if the channel was not registered yet
   */
  public boolean add(final SyncChannel channel) {
    Objects.requireNonNull(channel, "channel must not be null");
    return channels.putIfAbsent(channel.id(), channel) == null;
  }

  /**
   * Unregisters a channel.
   *
   * @param channel the channel, never null
   * @return true if the channel was registered
   */
  public boolean remove(final SyncChannel channel) {
    Objects.requireNonNull(channel, "channel must not be null");
    return channels.remove(channel.id(), channel);
  }

  /**
   * Returns the number of registered channels.
   *
   * @return the size
   */
  public int size() {
    return channels.size();
  }

  /**
   * Sends an event to every registered channel.
   *
   * @param event the event, never null
   * @return the number of channels the event was handed to
   */
  public int broadcast(final SyncEvent event) {
    Objects.requireNonNull(event, "event must not be null");
    int count = 0;
    for (SyncChannel channel : channels.values()) {
      send(channel, event);
      count++;
    }
    return count;
  }

  /**
   * Sends an event to one channel, logging a failure.
   *
   * @param channel the target channel, never null
   * @param event the event, never null
   */
  public void send(final SyncChannel channel, final SyncEvent event) {
    try {
      channel.send(event).whenComplete((ignored, error) -> {
        if (error != null) {
          log.warn("Failed to send '{}' to channel '{}': {}",
              event.name(), channel.id(), error.getMessage());
        }
      });
    } catch (final RuntimeException e) {
      log.warn("Failed to send '{}' to channel '{}': {}",
          event.name(), channel.id(), e.getMessage());
    }
  }

  /**
   * Closes and unregisters every channel.
   *
   * @return the number of channels unregistered
   */
  public int closeAll() {
    final List<SyncChannel> open = List.copyOf(channels.values());
    channels.clear();
    for (SyncChannel channel : open) {
      try {
        channel.close();
      } catch (final RuntimeException e) {
        log.warn("Failed to close channel '{}': {}", channel.id(),
            e.getMessage());
      }
    }
    return open.size();
  }
}
