package org.waabox.vecino.spring;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.waabox.vecino.server.PersistencePolicy;

/**
 * Configuration properties for the sync server, mapped from the
 * {@code vecino.*} prefix in application.yml or application.properties.
 *
 * <p>Supports:
 * <ul>
 *   <li>{@code vecino.path} - the WebSocket endpoint path, {@code /sync}
 *       by default.</li>
 *   <li>{@code vecino.allowed-origins} - the origin patterns allowed to
 *       open the WebSocket, {@code *} by default.</li>
 *   <li>{@code vecino.persistence-policy} - {@code best-effort} or
 *       {@code durable}.</li>
 *   <li>{@code vecino.max-text-message-size} - the largest accepted
 *       frame, in characters.</li>
 *   <li>{@code vecino.send-time-limit} and
 *       {@code vecino.send-buffer-size-limit} - how long and how much a slow
 *       client may hold back its outgoing messages before it is
 *       disconnected.</li>
 *   <li>{@code vecino.store.*} - the listing store backend.</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "vecino")
public class VecinoProperties {

  /** The WebSocket endpoint path. */
  private String path = "/sync";

  /** The origin patterns allowed to connect. */
  private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

  /** What to do when a mutation cannot be persisted. */
  private PersistencePolicy persistencePolicy = PersistencePolicy.BEST_EFFORT;

  /** The largest accepted text frame, in characters. */
  private int maxTextMessageSize = 1024 * 1024;

  /** How long a single send to a client may block. */
  private Duration sendTimeLimit = Duration.ofSeconds(10);

  /** How many bytes may be buffered for a slow client. */
  private int sendBufferSizeLimit = 4 * 1024 * 1024;

  /** The listing store settings. */
  private final Store store = new Store();

  public String getPath() {
    return path;
  }

  public void setPath(final String path) {
    this.path = path;
  }

  public List<String> getAllowedOrigins() {
    return allowedOrigins;
  }

  public void setAllowedOrigins(final List<String> allowedOrigins) {
    this.allowedOrigins = allowedOrigins;
  }

  public PersistencePolicy getPersistencePolicy() {
    return persistencePolicy;
  }

  public void setPersistencePolicy(final PersistencePolicy persistencePolicy) {
    this.persistencePolicy = persistencePolicy;
  }

  public int getMaxTextMessageSize() {
    return maxTextMessageSize;
  }

  public void setMaxTextMessageSize(final int maxTextMessageSize) {
    this.maxTextMessageSize = maxTextMessageSize;
  }

  public Duration getSendTimeLimit() {
    return sendTimeLimit;
  }

  public void setSendTimeLimit(final Duration sendTimeLimit) {
    this.sendTimeLimit = sendTimeLimit;
  }

  public int getSendBufferSizeLimit() {
    return sendBufferSizeLimit;
  }

  public void setSendBufferSizeLimit(final int sendBufferSizeLimit) {
    this.sendBufferSizeLimit = sendBufferSizeLimit;
  }

  public Store getStore() {
    return store;
  }

  /** The kind of listing store backend. */
  public enum StoreType {

    /** S3 when a bucket is configured, the local file otherwise. */
    AUTO,

    /** A single local JSON file. */
    FILESYSTEM,

    /** One object per listing in an S3 bucket. */
    S3
  }

  /**
   * Listing store settings, under {@code vecino.store.*}.
   *
   * @author waabox(waabox[at]gmail[dot]com)
   */
  public static class Store {

    /** The backend to use. */
    private StoreType type = StoreType.AUTO;

    /** The JSON file of the file system backend. */
    private String file = "listings.json";

    /** The S3 backend settings. */
    private final S3 s3 = new S3();

    public StoreType getType() {
      return type;
    }

    public void setType(final StoreType type) {
      this.type = type;
    }

    public String getFile() {
      return file;
    }

    public void setFile(final String file) {
      this.file = file;
    }

    public S3 getS3() {
      return s3;
    }
  }

  /**
   * S3 backend settings, under {@code vecino.store.s3.*}.
   *
   * @author waabox(waabox[at]gmail[dot]com)
   */
  public static class S3 {

    /** The bucket, null when the S3 backend is not configured. */
    private String bucket;

    /** The key prefix, null for the store default. */
    private String prefix;

    /** The AWS region. */
    private String region = "us-east-1";

    /** An endpoint override for S3-compatible servers. */
    private URI endpoint;

    public String getBucket() {
      return bucket;
    }

    public void setBucket(final String bucket) {
      this.bucket = bucket;
    }

    public String getPrefix() {
      return prefix;
    }

    public void setPrefix(final String prefix) {
      this.prefix = prefix;
    }

    public String getRegion() {
      return region;
    }

    public void setRegion(final String region) {
      this.region = region;
    }

    public URI getEndpoint() {
      return endpoint;
    }

    public void setEndpoint(final URI endpoint) {
      this.endpoint = endpoint;
    }
  }
}
