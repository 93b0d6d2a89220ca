/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.ferry.controller.gateway;

import dev.mars.ferry.controller.config.AppConfig;
import dev.mars.ferry.core.exceptions.GatewayException;
import dev.mars.ferry.gateway.Credential;
import dev.mars.ferry.gateway.ObjectMetadata;
import dev.mars.ferry.gateway.ObjectStoreGateway;
import io.minio.BucketExistsArgs;
import io.minio.GetPresignedObjectUrlArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.StatObjectArgs;
import io.minio.StatObjectResponse;
import io.minio.errors.ErrorResponseException;
import io.minio.http.Method;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * {@link ObjectStoreGateway} over an S3-compatible store, using the MinIO Java SDK.
 *
 * <p>Two clients share the credentials: the internal one signs write URLs for agents and
 * performs bucket and stat calls, the external one signs read URLs with the host name that
 * downloaders can reach. Both carry a fixed region so that signing never needs a network
 * round trip. SDK calls are blocking and run on Vert.x worker threads.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class MinioObjectStoreGateway implements ObjectStoreGateway {

    private static final Logger logger = LoggerFactory.getLogger(MinioObjectStoreGateway.class);

    private static final Set<String> NOT_FOUND_CODES = Set.of("NoSuchKey", "NoSuchObject", "NotFound");

    private final Vertx vertx;
    private final MinioClient internalClient;
    private final MinioClient externalClient;
    private final String bucket;
    private final Clock clock;

    public MinioObjectStoreGateway(Vertx vertx, MinioClient internalClient, MinioClient externalClient,
                                   String bucket, Clock clock) {
        this.vertx = vertx;
        this.internalClient = internalClient;
        this.externalClient = externalClient;
        this.bucket = bucket;
        this.clock = clock;
    }

    public static MinioObjectStoreGateway create(Vertx vertx, AppConfig config) {
        MinioClient internal = client(config.getStorageEndpoint(), config);
        MinioClient external = config.getStorageExternalEndpoint().equals(config.getStorageEndpoint())
                ? internal
                : client(config.getStorageExternalEndpoint(), config);
        logger.info("MinioObjectStoreGateway initialized with endpoint: {}, external: {}, bucket: {}",
                config.getStorageEndpoint(), config.getStorageExternalEndpoint(), config.getStorageBucket());
        return new MinioObjectStoreGateway(vertx, internal, external, config.getStorageBucket(), Clock.systemUTC());
    }

    private static MinioClient client(String endpoint, AppConfig config) {
        return MinioClient.builder()
                .endpoint(endpoint)
                .credentials(config.getStorageAccessKey(), config.getStorageSecretKey())
                .region(config.getStorageRegion())
                .build();
    }

    /**
     * Creates the bucket when it does not exist yet.
     */
    public Future<Void> ensureBucket() {
        return blocking(bucket, "Error ensuring bucket exists", () -> {
            boolean found = internalClient.bucketExists(BucketExistsArgs.builder().bucket(bucket).build());
            if (!found) {
                internalClient.makeBucket(MakeBucketArgs.builder().bucket(bucket).build());
                logger.info("Created bucket: {}", bucket);
            } else {
                logger.info("Bucket already exists: {}", bucket);
            }
            return null;
        });
    }

    @Override
    public Future<Credential> issueWriteCredential(String objectKey, Duration ttl) {
        return blocking(objectKey, "Error generating presigned PUT URL", () -> {
            Instant expiresAt = clock.instant().plus(ttl);
            String url = internalClient.getPresignedObjectUrl(GetPresignedObjectUrlArgs.builder()
                    .method(Method.PUT)
                    .bucket(bucket)
                    .object(objectKey)
                    .expiry(toSeconds(ttl))
                    .build());
            logger.debug("Generated presigned PUT URL for {}, expires in {}s", objectKey, ttl.toSeconds());
            return new Credential(url, expiresAt);
        });
    }

    @Override
    public Future<Credential> issueReadCredential(String objectKey, Duration ttl, String dispositionName) {
        return blocking(objectKey, "Error generating presigned GET URL", () -> {
            Instant expiresAt = clock.instant().plus(ttl);
            GetPresignedObjectUrlArgs.Builder args = GetPresignedObjectUrlArgs.builder()
                    .method(Method.GET)
                    .bucket(bucket)
                    .object(objectKey)
                    .expiry(toSeconds(ttl));
            if (dispositionName != null && !dispositionName.isBlank()) {
                args.extraQueryParams(Map.of("response-content-disposition", contentDisposition(dispositionName)));
            }
            String url = externalClient.getPresignedObjectUrl(args.build());
            logger.debug("Generated presigned GET URL for {}, expires in {}s", objectKey, ttl.toSeconds());
            return new Credential(url, expiresAt);
        });
    }

    @Override
    public Future<Boolean> exists(String objectKey) {
        return statMetadata(objectKey).map(Optional::isPresent);
    }

    @Override
    public Future<Optional<ObjectMetadata>> statMetadata(String objectKey) {
        return blocking(objectKey, "Error reading object metadata", () -> {
            try {
                StatObjectResponse stat = internalClient.statObject(StatObjectArgs.builder()
                        .bucket(bucket)
                        .object(objectKey)
                        .build());
                return Optional.of(new ObjectMetadata(stat.size(), stat.etag()));
            } catch (ErrorResponseException e) {
                if (NOT_FOUND_CODES.contains(e.errorResponse().code())) {
                    logger.debug("Object not found: {}", objectKey);
                    return Optional.empty();
                }
                throw e;
            }
        });
    }

    static String contentDisposition(String name) {
        return "attachment; filename=\"" + name.replaceAll("[\"\\\\\\r\\n]", "_") + "\"";
    }

    private static int toSeconds(Duration ttl) {
        return (int) Math.min(Integer.MAX_VALUE, ttl.toSeconds());
    }

    private <T> Future<T> blocking(String objectKey, String message, Callable<T> call) {
        return vertx.<T>executeBlocking(call, false)
                .recover(err -> {
                    logger.error("{} for {}: {}", message, objectKey, err.getMessage());
                    return Future.failedFuture(new GatewayException(objectKey, message, err));
                });
    }
}
