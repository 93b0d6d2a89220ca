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

package dev.mars.ferry.agent.service;

import dev.mars.ferry.core.exceptions.TransferException;
import dev.mars.ferry.storage.ChecksumCalculator;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

/**
 * Streams a local file to a presigned PUT URL while computing its SHA-256.
 *
 * <p>Each attempt runs on the bounded {@code ferry-transfer} worker pool, one pool thread per
 * transfer. The digest is updated from the same buffer slice that is written to the
 * connection, so it covers exactly the bytes sent.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class HttpStreamingUploader implements TransferUploader {

    private static final Logger logger = LoggerFactory.getLogger(HttpStreamingUploader.class);

    public static final String WORKER_POOL_NAME = "ferry-transfer";
    private static final int BUFFER_SIZE = 8192; // 8KB buffer
    private static final int MAX_ERROR_BODY = 512;

    private final WorkerExecutor executor;
    private final int connectTimeoutMs;
    private final int readTimeoutMs;

    public HttpStreamingUploader(Vertx vertx, int maxConcurrentTransfers, int connectTimeoutMs, int readTimeoutMs) {
        this.executor = vertx.createSharedWorkerExecutor(WORKER_POOL_NAME, maxConcurrentTransfers,
                Duration.ofHours(1).toNanos());
        this.connectTimeoutMs = connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs;
        logger.info("HttpStreamingUploader initialized: poolSize={}, connectTimeout={}ms, readTimeout={}ms",
                maxConcurrentTransfers, connectTimeoutMs, readTimeoutMs);
    }

    @Override
    public Future<UploadResult> upload(String transferId, Path source, String writeCredential) {
        return executor.executeBlocking(() -> performUpload(transferId, source, writeCredential), false);
    }

    public Future<Void> close() {
        return executor.close();
    }

    UploadResult performUpload(String transferId, Path source, String writeCredential) throws TransferException {
        if (!Files.isRegularFile(source)) {
            throw new TransferException(transferId, "File not found: " + source);
        }

        long size;
        try {
            size = Files.size(source);
        } catch (IOException e) {
            throw new TransferException(transferId, "Cannot read size of " + source + ": " + e.getMessage(), e);
        }

        Instant start = Instant.now();
        HttpURLConnection connection = openConnection(transferId, writeCredential, size);
        try {
            UploadResult result = streamBody(transferId, connection, source, size);

            int status = connection.getResponseCode();
            if (status < 200 || status >= 300) {
                throw new TransferException(transferId,
                        "HTTP " + status + " from object store: " + readErrorBody(connection));
            }

            logger.info("Uploaded {} bytes for transfer {} in {}ms", result.bytesSent(), transferId,
                    Duration.between(start, Instant.now()).toMillis());
            return result;
        } catch (IOException e) {
            throw new TransferException(transferId, "Upload I/O error: " + e.getMessage(), e);
        } finally {
            connection.disconnect();
        }
    }

    private HttpURLConnection openConnection(String transferId, String writeCredential, long size)
            throws TransferException {
        try {
            HttpURLConnection connection = (HttpURLConnection) URI.create(writeCredential).toURL().openConnection();
            connection.setRequestMethod("PUT");
            connection.setDoOutput(true);
            connection.setConnectTimeout(connectTimeoutMs);
            connection.setReadTimeout(readTimeoutMs);
            connection.setFixedLengthStreamingMode(size);
            connection.setRequestProperty("Content-Type", "application/octet-stream");
            connection.setRequestProperty("User-Agent", "Ferry-Agent/1.0");
            return connection;
        } catch (IOException | IllegalArgumentException e) {
            throw new TransferException(transferId, "Failed to create HTTP connection: " + e.getMessage(), e);
        }
    }

    private UploadResult streamBody(String transferId, HttpURLConnection connection, Path source, long size)
            throws IOException, TransferException {
        ChecksumCalculator checksumCalculator = new ChecksumCalculator();
        try (InputStream inputStream = new BufferedInputStream(Files.newInputStream(source));
             OutputStream outputStream = connection.getOutputStream()) {

            byte[] buffer = new byte[BUFFER_SIZE];
            int bytesRead;
            while ((bytesRead = inputStream.read(buffer)) != -1) {
                if (checksumCalculator.getByteCount() + bytesRead > size) {
                    throw new TransferException(transferId, "Source file grew during upload: " + source);
                }
                outputStream.write(buffer, 0, bytesRead);
                checksumCalculator.update(buffer, 0, bytesRead);
            }
            outputStream.flush();
        }

        long sent = checksumCalculator.getByteCount();
        if (sent != size) {
            throw new TransferException(transferId,
                    "Source file shrank during upload: expected " + size + " bytes, read " + sent);
        }
        return new UploadResult(sent, checksumCalculator.getChecksum());
    }

    private static String readErrorBody(HttpURLConnection connection) {
        try (InputStream err = connection.getErrorStream()) {
            if (err == null) {
                return "<no body>";
            }
            byte[] body = err.readNBytes(MAX_ERROR_BODY);
            return new String(body, StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.debug("Could not read error body: {}", e.getMessage());
            return "<unreadable body>";
        }
    }
}
