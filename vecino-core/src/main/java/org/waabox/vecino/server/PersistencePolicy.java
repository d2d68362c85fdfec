package org.waabox.vecino.server;

/**
 * What the coordinator does with a mutation whose persistence failed.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum PersistencePolicy {

  /**
   * The failure is logged; the replica is still updated and the change is
   * still broadcast. Clients stay live while the backend is down.
   */
  BEST_EFFORT,

  /**
   * The failure is logged and the mutation is dropped: no replica change
   * and no broadcast. Clients never see a change the backend lost.
   */
  DURABLE
}
