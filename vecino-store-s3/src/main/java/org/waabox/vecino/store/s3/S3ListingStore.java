package org.waabox.vecino.store.s3;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.vecino.PersistenceException;
import org.waabox.vecino.listing.Listing;
import org.waabox.vecino.listing.ListingCodec;
import org.waabox.vecino.store.ListingStore;

import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;

/**
 * A {@link ListingStore} that keeps each listing as its own object in an
 * Amazon S3 bucket.
 *
 * <p>Objects use the following key layout:
 * <pre>
 * {prefix}{listingId}.json
 * </pre>
 *
 * <p>{@link #loadAll()} lists every object under the prefix and reads them
 * in key order. An object whose content is not a valid listing is logged
 * and skipped; failing to reach S3 is reported as a
 * {@link PersistenceException}.
 *
 * <p>When no {@link S3Client} is provided via the config, this store
 * creates one and closes it on {@link #close()}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class S3ListingStore implements ListingStore, AutoCloseable {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(S3ListingStore.class);

  /** The suffix of every listing object key. */
  private static final String SUFFIX = ".json";

  /** The content type of every listing object. */
  private static final String CONTENT_TYPE = "application/json";

  /** The S3 bucket name. */
  private final String bucket;

  /** The key prefix within the bucket. */
  private final String prefix;

  /** The S3 client used for all operations. */
  private final S3Client s3Client;

  /** Whether this store owns the S3 client and should close it. */
  private final boolean ownsClient;

  /**
   * Creates a new store from the given configuration.
   *
   * @param config the configuration, never null
   *
   * @throws NullPointerException if config is null
   */
  public S3ListingStore(final S3ListingStoreConfig config) {
    Objects.requireNonNull(config, "config must not be null");

    bucket = config.bucket();
    prefix = config.prefix();

    if (config.s3Client().isPresent()) {
      s3Client = config.s3Client().get();
      ownsClient = false;
    } else {
      final S3ClientBuilder builder = S3Client.builder()
          .region(config.region());
      config.endpoint().ifPresent(endpoint -> builder
          .endpointOverride(endpoint)
          .forcePathStyle(true));
      s3Client = builder.build();
      ownsClient = true;
    }
  }

  /**
   * {@inheritDoc}
   *
   * @throws PersistenceException if S3 cannot be listed or read
   */
  @Override
  public List<Listing> loadAll() {
    log.debug("Loading listings from s3://{}/{}", bucket, prefix);

    final List<Listing> listings = new ArrayList<>();
    String continuationToken = null;
    try {
      do {
        final ListObjectsV2Response page = s3Client.listObjectsV2(
            ListObjectsV2Request.builder()
                .bucket(bucket)
                .prefix(prefix)
                .continuationToken(continuationToken)
                .build());

        for (S3Object object : page.contents()) {
          if (object.key().endsWith(SUFFIX)) {
            read(object.key()).ifPresent(listings::add);
          }
        }
        continuationToken = Boolean.TRUE.equals(page.isTruncated())
            ? page.nextContinuationToken()
            : null;
      } while (continuationToken != null);
    } catch (final SdkException e) {
      throw new PersistenceException("Failed to list listings in s3://"
          + bucket + "/" + prefix, e);
    }

    log.info("Loaded {} listing(s) from s3://{}/{}", listings.size(), bucket,
        prefix);
    return listings;
  }

  /**
   * {@inheritDoc}
   *
   * <p>Overwrites the object of a listing with the same id.
   *
   * @throws PersistenceException if the put fails
   */
  @Override
  public void save(final Listing listing) {
    Objects.requireNonNull(listing, "listing must not be null");

    final String key = buildKey(listing.id());
    final PutObjectRequest request = PutObjectRequest.builder()
        .bucket(bucket)
        .key(key)
        .contentType(CONTENT_TYPE)
        .build();
    try {
      s3Client.putObject(request,
          RequestBody.fromBytes(ListingCodec.serializeOne(listing)));
    } catch (final SdkException e) {
      throw new PersistenceException("Failed to save listing '"
          + listing.id() + "' to s3://" + bucket + "/" + key, e);
    }
    log.debug("Saved listing '{}' to s3://{}/{}", listing.id(), bucket, key);
  }

  /**
   * {@inheritDoc}
   *
   * <p>Deleting a missing object succeeds.
   *
   * @throws PersistenceException if the delete fails
   */
  @Override
  public void delete(final String listingId) {
    Objects.requireNonNull(listingId, "listingId must not be null");

    final String key = buildKey(listingId);
    try {
      s3Client.deleteObject(DeleteObjectRequest.builder()
          .bucket(bucket)
          .key(key)
          .build());
    } catch (final SdkException e) {
      throw new PersistenceException("Failed to delete listing '"
          + listingId + "' from s3://" + bucket + "/" + key, e);
    }
    log.debug("Deleted listing '{}' from s3://{}/{}", listingId, bucket, key);
  }

  /**
   * Closes the S3 client if this store created it.
   */
  @Override
  public void close() {
    if (ownsClient) {
      log.debug("Closing S3 client owned by this store");
      s3Client.close();
    }
  }

  /** Reads one listing object.
   *
   * @param key the object key, never null.
   * @return the listing, or empty if the object vanished or is corrupt.
   */
  private Optional<Listing> read(final String key) {
    final GetObjectRequest request = GetObjectRequest.builder()
        .bucket(bucket)
        .key(key)
        .build();

    try (ResponseInputStream<GetObjectResponse> response =
             s3Client.getObject(request)) {
      return Optional.of(
          ListingCodec.deserializeOne(response.readAllBytes()));

    } catch (final NoSuchKeyException e) {
      log.debug("Listing object s3://{}/{} was deleted while loading", bucket,
          key);
      return Optional.empty();

    } catch (final IllegalArgumentException e) {
      log.warn("Skipping corrupt listing object s3://{}/{}: {}", bucket, key,
          e.getMessage());
      return Optional.empty();

    } catch (final IOException e) {
      throw new PersistenceException("Failed to read listing object s3://"
          + bucket + "/" + key, e);
    }
  }

  /**
   * Builds the S3 object key for a listing id.
   *
   * @param listingId the listing id, never null
   * @return the full S3 object key, never null
   */
  private String buildKey(final String listingId) {
    return prefix + listingId + SUFFIX;
  }
}
