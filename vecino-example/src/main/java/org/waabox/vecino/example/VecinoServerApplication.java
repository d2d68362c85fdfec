package org.waabox.vecino.example;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Spring Boot application entry point for the listings sync server.
 *
 * <p>This application wires the sync engine through the starter:
 * <ul>
 *   <li>a WebSocket endpoint at {@code /sync} carrying the sync events</li>
 *   <li>a local JSON file or an S3 bucket holding the listings</li>
 *   <li>REST endpoints for inspecting the authoritative replica</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@SpringBootApplication
public class VecinoServerApplication {

  /** Launches the Spring Boot application.
   *
   * @param args the command-line arguments
   */
  public static void main(final String[] args) {
    SpringApplication.run(VecinoServerApplication.class, args);
  }
}
