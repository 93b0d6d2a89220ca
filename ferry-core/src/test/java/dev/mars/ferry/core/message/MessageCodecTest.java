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

import dev.mars.ferry.core.FailureCategory;
import dev.mars.ferry.core.FailureReason;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MessageCodec")
class MessageCodecTest {

    private static final Instant EXPIRY = Instant.parse("2026-03-02T10:15:00Z");

    @Nested
    @DisplayName("Commands")
    class Commands {

        @Test
        void encodesKindAndIsoTimestamp() {
            TransferCommand command = new TransferCommand("t-1", "agent-1/t-1-report.csv",
                    "https://store/put?sig=abc", EXPIRY, Map.of("requestedBy", "ops"));

            String json = MessageCodec.encodeCommand(command);

            assertThat(json)
                    .contains("\"kind\":\"upload\"")
                    .contains("\"credentialExpiry\":\"2026-03-02T10:15:00Z\"")
                    .contains("\"requestedBy\":\"ops\"");
        }

        @Test
        void decodesAndIgnoresUnknownFields() {
            String json = "{\"kind\":\"upload\",\"transferId\":\"t-1\",\"objectKey\":\"a/t-1-f\","
                    + "\"writeCredential\":\"https://u\",\"credentialExpiry\":\"2026-03-02T10:15:00Z\","
                    + "\"priority\":7}";

            TransferCommand command = MessageCodec.decodeCommand(json);

            assertThat(command.transferId()).isEqualTo("t-1");
            assertThat(command.credentialExpiry()).isEqualTo(EXPIRY);
            assertThat(command.meta()).isEmpty();
            assertThat(command.isStructurallyValid()).isTrue();
        }

        @Test
        void missingFieldsDecodeButAreStructurallyInvalid() {
            TransferCommand command = MessageCodec.decodeCommand("{\"kind\":\"upload\",\"transferId\":\"t-1\"}");

            assertThat(command.isStructurallyValid()).isFalse();
        }

        @Test
        void rejectsOtherKinds() {
            assertThatThrownBy(() -> MessageCodec.decodeCommand("{\"kind\":\"delete\",\"transferId\":\"t-1\"}"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("delete");
        }

        @Test
        void toStringNeverShowsCredential() {
            TransferCommand command = new TransferCommand("t-1", "k", "https://store/put?sig=secret", EXPIRY, null);

            assertThat(command.toString()).doesNotContain("secret");
        }

        @Test
        void expiryIsStrictlyBeforeNow() {
            TransferCommand command = new TransferCommand("t-1", "k", "u", EXPIRY, null);

            assertThat(command.isExpiredAt(EXPIRY)).isFalse();
            assertThat(command.isExpiredAt(EXPIRY.plusMillis(1))).isTrue();
        }
    }

    @Nested
    @DisplayName("Events")
    class Events {

        @Test
        void completeEventCarriesKind() {
            UploadCompleteEvent event = new UploadCompleteEvent("t-1", "a/t-1-f", 104857600L, "ab12", EXPIRY);

            String json = MessageCodec.encodeEvent(event);

            assertThat(json).contains("\"kind\":\"complete\"").contains("\"size\":104857600");
            assertThat(MessageCodec.decodeEvent(json)).isEqualTo(event);
        }

        @Test
        void failedEventWithoutCategoryFallsBackToAgentReported() {
            String json = "{\"kind\":\"failed\",\"transferId\":\"t-2\",\"objectKey\":\"a/t-2-f\","
                    + "\"reason\":\"disk unplugged\",\"timestamp\":\"2026-03-02T10:15:00Z\"}";

            TransferEvent event = MessageCodec.decodeEvent(json);

            assertThat(event).isInstanceOf(UploadFailedEvent.class);
            FailureReason reason = ((UploadFailedEvent) event).toFailureReason();
            assertThat(reason.category()).isEqualTo(FailureCategory.AGENT_REPORTED);
            assertThat(reason.detail()).isEqualTo("disk unplugged");
        }

        @Test
        void unknownCategoryDecodesAsNull() {
            String json = "{\"kind\":\"failed\",\"transferId\":\"t-3\",\"reason\":\"x\",\"category\":\"QUOTA\"}";

            UploadFailedEvent event = (UploadFailedEvent) MessageCodec.decodeEvent(json);

            assertThat(event.category()).isNull();
            assertThat(event.toFailureReason().category()).isEqualTo(FailureCategory.AGENT_REPORTED);
        }

        @Test
        void knownCategoryIsKept() {
            UploadFailedEvent event = new UploadFailedEvent("t-4", "k", "credential expired",
                    FailureCategory.CREDENTIAL_EXPIRED, EXPIRY);

            UploadFailedEvent decoded = (UploadFailedEvent) MessageCodec.decodeEvent(MessageCodec.encodeEvent(event));

            assertThat(decoded.category()).isEqualTo(FailureCategory.CREDENTIAL_EXPIRED);
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "", "not json", "[]", "{\"transferId\":\"t-1\"}", "{\"kind\":\"progress\",\"transferId\":\"t-1\"}",
                "{\"kind\":\"complete\",\"size\":10}"
        })
        void malformedPayloadsAreRejected(String json) {
            assertThatThrownBy(() -> MessageCodec.decodeEvent(json))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "{\"kind\":\"complete\",\"transferId\":\"t-1\"}",
                "{\"kind\":\"complete\",\"transferId\":\"t-1\",\"size\":10,\"digest\":\"ab\"}",
                "{\"kind\":\"complete\",\"transferId\":\"t-1\",\"objectKey\":\"a/t-1-f\",\"digest\":\"ab\"}",
                "{\"kind\":\"complete\",\"transferId\":\"t-1\",\"objectKey\":\"a/t-1-f\",\"size\":10}"
        })
        void completeEventMissingUploadFieldsIsRejected(String json) {
            assertThatThrownBy(() -> MessageCodec.decodeEvent(json))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void completeEventWithNegativeSizeIsRejected() {
            String json = "{\"kind\":\"complete\",\"transferId\":\"t-1\",\"objectKey\":\"a/t-1-f\","
                    + "\"size\":-1,\"digest\":\"ab\"}";

            assertThatThrownBy(() -> MessageCodec.decodeEvent(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("negative size");
        }

        @Test
        void completeEventWithBlankDigestIsRejected() {
            String json = "{\"kind\":\"complete\",\"transferId\":\"t-1\",\"objectKey\":\"a/t-1-f\","
                    + "\"size\":10,\"digest\":\"  \"}";

            assertThatThrownBy(() -> MessageCodec.decodeEvent(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("no digest");
        }

        @Test
        void emptyUploadIsAccepted() {
            String json = "{\"kind\":\"complete\",\"transferId\":\"t-1\",\"objectKey\":\"a/t-1-f\","
                    + "\"size\":0,\"digest\":\"" + "e3".repeat(32) + "\"}";

            UploadCompleteEvent event = (UploadCompleteEvent) MessageCodec.decodeEvent(json);

            assertThat(event.size()).isZero();
        }
    }

    @Test
    void metaRoundTripsThroughStorageEncoding() {
        Map<String, Object> meta = Map.of("requestedBy", "ops", "reason", "audit");

        assertThat(MessageCodec.decodeMeta(MessageCodec.encodeMeta(meta))).isEqualTo(meta);
        assertThat(MessageCodec.decodeMeta(null)).isEmpty();
    }
}
