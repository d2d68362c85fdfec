package org.waabox.vecino.store.s3;

import java.net.URI;
import java.util.Objects;
import java.util.Optional;

import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * Immutable configuration for the S3-backed listing store.
 *
 * <p>Holds the bucket, the key prefix, the AWS region and an optional
 * pre-built {@link S3Client}. When no client is given, the
 * {@link S3ListingStore} builds one from the region and, when set, the
 * endpoint override. An endpoint override switches the client to
 * path-style addressing, which S3-compatible servers such as MinIO or
 * LocalStack expect.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class S3ListingStoreConfig {

  /** Default key prefix used when none is specified. */
  private static final String DEFAULT_PREFIX = "vecino/listings/";

  /** The S3 bucket name, never null. */
  private final String bucket;

  /** The key prefix within the bucket, never null. */
  private final String prefix;

  /** The AWS region for the S3 client, never null. */
  private final Region region;

  /** An optional endpoint override, may be null. */
  private final URI endpoint;

  /** An optional pre-built S3 client, may be null. */
  private final S3Client s3Client;

  /** Creates a config from the builder.
   *
   * @param builder the builder to construct from, never null
   */
  private S3ListingStoreConfig(final Builder builder) {
    bucket = Objects.requireNonNull(builder.bucket,
        "bucket must not be null");
    region = Objects.requireNonNull(builder.region,
        "region must not be null");
    if (bucket.isBlank()) {
      throw new IllegalArgumentException("bucket must not be blank");
    }
    prefix = normalize(builder.prefix);
    endpoint = builder.endpoint;
    s3Client = builder.s3Client;
  }

  /**
   * Returns the S3 bucket name.
   *
   * @return the bucket name, never null
   */
  public String bucket() {
    return bucket;
  }

  /**
   * Returns the key prefix under which each listing is stored.
   *
   * <p>Defaults to {@code "vecino/listings/"}. A non-empty prefix always
   * ends with a slash.
   *
   * @return the key prefix, never null
   */
  public String prefix() {
    return prefix;
  }

  /**
   * Returns the AWS region.
   *
   * @return the AWS region, never null
   */
  public Region region() {
    return region;
  }

  /**
   * Returns the endpoint override.
   *
   * @return the endpoint, or empty to use the AWS default
   */
  public Optional<URI> endpoint() {
    return Optional.ofNullable(endpoint);
  }

  /**
   * Returns the optional pre-built S3 client.
   *
   * @return the client, or empty when the store builds its own
   */
  public Optional<S3Client> s3Client() {
    return Optional.ofNullable(s3Client);
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder instance, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Appends the trailing slash to a non-empty prefix.
   *
   * @param prefix the configured prefix, may be null.
   * @return the prefix to use, never null.
   */
  private static String normalize(final String prefix) {
    if (prefix == null) {
      return DEFAULT_PREFIX;
    }
    if (prefix.isEmpty() || prefix.endsWith("/")) {
      return prefix;
    }
    return prefix + "/";
  }

  /**
   * A builder for {@link S3ListingStoreConfig} instances.
   *
   * <p>Required fields: {@code bucket} and {@code region}.
   *
   * @author waabox(waabox[at]gmail[dot]com)
   */
  public static final class Builder {

    /** The S3 bucket name. */
    private String bucket;

    /** The key prefix within the bucket. */
    private String prefix;

    /** The AWS region. */
    private Region region;

    /** The endpoint override. */
    private URI endpoint;

    /** The optional pre-built S3 client. */
    private S3Client s3Client;

    /** Private constructor, use {@link S3ListingStoreConfig#builder()}. */
    private Builder() {
    }

    /**
     * Sets the S3 bucket name.
     *
     * @param theBucket the bucket name, never null
     * @return this builder for chaining, never null
     */
    public Builder bucket(final String theBucket) {
      bucket = theBucket;
      return this;
    }

    /**
     * Sets the key prefix.
     *
     * @param thePrefix the key prefix, null for the default
     * @return this builder for chaining, never null
     */
    public Builder prefix(final String thePrefix) {
      prefix = thePrefix;
      return this;
    }

    /**
     * Sets the AWS region.
     *
     * @param theRegion the AWS region, never null
     * @return this builder for chaining, never null
     */
    public Builder region(final Region theRegion) {
      region = theRegion;
      return this;
    }

    /**
     * Sets an endpoint override for S3-compatible servers.
     *
     * @param theEndpoint the endpoint, may be null
     * @return this builder for chaining, never null
     */
    public Builder endpoint(final URI theEndpoint) {
      endpoint = theEndpoint;
      return this;
    }

    /**
     * Sets a pre-built S3 client. The store does not close it.
     *
     * @param theS3Client the S3 client, may be null
     * @return this builder for chaining, never null
     */
    public Builder s3Client(final S3Client theS3Client) {
      s3Client = theS3Client;
      return this;
    }

    /**
     * Builds the config.
     *
     * @return a new immutable config instance, never null
     *
     * @throws NullPointerException if bucket or region is null
     * @throws IllegalArgumentException if bucket is blank
     */
    public S3ListingStoreConfig build() {
      return new S3ListingStoreConfig(this);
    }
  }
}
