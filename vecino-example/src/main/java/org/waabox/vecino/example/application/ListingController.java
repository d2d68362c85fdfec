package org.waabox.vecino.example.application;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import org.waabox.vecino.listing.Listing;
import org.waabox.vecino.server.SyncCoordinator;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/** REST controller that exposes the authoritative listings replica for
 * inspection.
 *
 * <p>This controller provides two endpoints:
 * <ul>
 *   <li>{@code GET /listings} - returns every listing in insertion
 *       order</li>
 *   <li>{@code GET /listings/info} - returns the listing count, the number
 *       of connected users and the persistence policy</li>
 * </ul>
 *
 * <p>Listings are changed only through the sync WebSocket.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@RestController
@RequestMapping("/listings")
public class ListingController {

  /** The sync coordinator owning the replica, never null. */
  private final SyncCoordinator coordinator;

  /** Creates a new ListingController.
   *
   * @param theCoordinator the sync coordinator, never null
   */
  public ListingController(final SyncCoordinator theCoordinator) {
    coordinator = Objects.requireNonNull(theCoordinator,
        "coordinator cannot be null");
  }

  /** Returns every listing of the authoritative replica.
   *
   * @return the listing documents in insertion order, never null
   */
  @GetMapping
  public List<ObjectNode> listings() {
    return coordinator.listings().stream()
        .map(Listing::document)
        .collect(Collectors.toList());
  }

  /** Returns information about the replica and its clients.
   *
   * @return a map with count, connectedUsers and persistencePolicy,
   *         never null
   */
  @GetMapping("/info")
  public Map<String, Object> info() {
    final Map<String, Object> info = new LinkedHashMap<>();
    info.put("count", coordinator.listings().size());
    info.put("connectedUsers", coordinator.connectedUsers());
    info.put("persistencePolicy", coordinator.persistencePolicy().name());
    return info;
  }
}
