package org.waabox.vecino.spring;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.vecino.store.ListingStore;
import org.waabox.vecino.store.fs.FileSystemListingStore;
import org.waabox.vecino.store.s3.S3ListingStore;
import org.waabox.vecino.store.s3.S3ListingStoreConfig;

import software.amazon.awssdk.regions.Region;

/**
 * Creates the listing store selected by {@link VecinoProperties.Store}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class ListingStores {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      ListingStores.class);

  /** Private constructor to prevent instantiation. */
  private ListingStores() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Resolves {@link VecinoProperties.StoreType#AUTO} into a concrete type.
   *
   * @param store the store settings, never null
   * @return {@code S3} or {@code FILESYSTEM}, never null
   */
  static VecinoProperties.StoreType resolveType(
      final VecinoProperties.Store store) {
    if (store.getType() != VecinoProperties.StoreType.AUTO) {
      return store.getType();
    }
    final String bucket = store.getS3().getBucket();
    return bucket != null && !bucket.isBlank()
        ? VecinoProperties.StoreType.S3
        : VecinoProperties.StoreType.FILESYSTEM;
  }

  /**
   * Creates the configured store.
   *
   * @param store the store settings, never null
   * @return the listing store, never null
   *
   * @throws IllegalStateException if S3 is selected without a bucket
   */
  static ListingStore create(final VecinoProperties.Store store) {
    if (resolveType(store) == VecinoProperties.StoreType.S3) {
      final VecinoProperties.S3 s3 = store.getS3();
      if (s3.getBucket() == null || s3.getBucket().isBlank()) {
        throw new IllegalStateException(
            "vecino.store.s3.bucket is required when vecino.store.type=s3");
      }
      log.info("Storing listings in S3 bucket '{}' ({})", s3.getBucket(),
          s3.getRegion());
      return new S3ListingStore(S3ListingStoreConfig.builder()
          .bucket(s3.getBucket())
          .prefix(s3.getPrefix())
          .region(Region.of(s3.getRegion()))
          .endpoint(s3.getEndpoint())
          .build());
    }
    final Path file = Path.of(store.getFile());
    log.info("Storing listings in file {}", file.toAbsolutePath());
    return new FileSystemListingStore(file);
  }
}
