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

package dev.mars.ferry.core.message;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Collections;
import java.util.Map;

/**
 * JSON encoding of the two wire shapes, {@link TransferCommand} and {@link TransferEvent}.
 *
 * <p>Timestamps are ISO-8601 strings. Unknown properties are ignored and an
 * unrecognised failure category decodes to {@code null}. A complete event must carry
 * {@code objectKey}, a non-negative {@code size} and a digest. Anything that cannot be
 * decoded into a complete message raises {@link IllegalArgumentException}; no partial
 * message is ever returned.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class MessageCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_AS_NULL);

    private static final ObjectWriter EVENT_WRITER = MAPPER.writerFor(TransferEvent.class);
    private static final ObjectReader EVENT_READER = MAPPER.readerFor(TransferEvent.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private MessageCodec() {
    }

    /**
     * Shared mapper configured for ferry payloads. Callers must not reconfigure it.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String encodeCommand(TransferCommand command) {
        try {
            return MAPPER.writeValueAsString(command);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode command " + command.transferId(), e);
        }
    }

    public static TransferCommand decodeCommand(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Empty command payload");
        }
        try {
            Map<String, Object> raw = MAPPER.readValue(json, MAP_TYPE);
            if (raw == null) {
                throw new IllegalArgumentException("Command payload is null");
            }
            Object kind = raw.get("kind");
            if (kind != null && !TransferCommand.KIND.equals(kind)) {
                throw new IllegalArgumentException("Unsupported command kind: " + kind);
            }
            return MAPPER.convertValue(raw, TransferCommand.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed command payload: " + e.getOriginalMessage(), e);
        }
    }

    public static String encodeEvent(TransferEvent event) {
        try {
            return EVENT_WRITER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode event " + event.transferId(), e);
        }
    }

    public static TransferEvent decodeEvent(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Empty event payload");
        }
        TransferEvent event;
        try {
            event = EVENT_READER.readValue(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed event payload: " + e.getOriginalMessage(), e);
        }
        if (event == null || event.transferId() == null || event.transferId().isBlank()) {
            throw new IllegalArgumentException("Event payload has no transferId");
        }
        if (event instanceof UploadCompleteEvent complete) {
            requireComplete(complete);
        }
        return event;
    }

    private static void requireComplete(UploadCompleteEvent event) {
        if (event.objectKey() == null || event.objectKey().isBlank()) {
            throw new IllegalArgumentException("Complete event for " + event.transferId() + " has no objectKey");
        }
        if (event.size() < 0) {
            throw new IllegalArgumentException("Complete event for " + event.transferId()
                    + " has negative size " + event.size());
        }
        if (event.digest() == null || event.digest().isBlank()) {
            throw new IllegalArgumentException("Complete event for " + event.transferId() + " has no digest");
        }
    }

    /**
     * Encodes opaque metadata for storage; an empty map encodes as {@code {}}.
     */
    public static String encodeMeta(Map<String, Object> meta) {
        try {
            return MAPPER.writeValueAsString(meta == null ? Collections.emptyMap() : meta);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode metadata", e);
        }
    }

    public static Map<String, Object> decodeMeta(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return MAPPER.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed metadata: " + e.getOriginalMessage(), e);
        }
    }
}
