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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Initiator to agent instruction to upload the agent's file under {@code objectKey}
 * using the supplied write credential.
 *
 * <p>Wire form: {@code {"kind":"upload","transferId","objectKey","writeCredential",
 * "credentialExpiry","meta"}}. Structural validity is not enforced on construction;
 * the agent checks it with {@link #isStructurallyValid()} so a malformed command can be
 * logged and discarded rather than failing the channel.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record TransferCommand(
        String transferId,
        String objectKey,
        String writeCredential,
        Instant credentialExpiry,
        Map<String, Object> meta) {

    public static final String KIND = "upload";

    public TransferCommand {
        meta = meta == null || meta.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(meta));
    }

    @JsonProperty("kind")
    public String kind() {
        return KIND;
    }

    /**
     * True when transfer id, object key and write credential are all present and non-blank.
     */
    @JsonIgnore
    public boolean isStructurallyValid() {
        return notBlank(transferId) && notBlank(objectKey) && notBlank(writeCredential);
    }

    /**
     * True when the credential expiry is known and strictly before {@code now}.
     */
    @JsonIgnore
    public boolean isExpiredAt(Instant now) {
        return credentialExpiry != null && credentialExpiry.isBefore(now);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    @Override
    public String toString() {
        // never print the credential
        return "TransferCommand{transferId='" + transferId + "', objectKey='" + objectKey
                + "', credentialExpiry=" + credentialExpiry + '}';
    }
}
