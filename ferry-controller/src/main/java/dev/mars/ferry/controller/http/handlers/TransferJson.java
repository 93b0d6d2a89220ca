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

package dev.mars.ferry.controller.http.handlers;

import dev.mars.ferry.core.TransferRecord;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.List;

/**
 * JSON views of transfer records. Credentials are never part of a view.
 */
final class TransferJson {

    private TransferJson() {
    }

    static JsonObject toJson(TransferRecord record) {
        JsonObject json = new JsonObject()
                .put("transferId", record.getId())
                .put("agentId", record.getAgentId())
                .put("objectKey", record.getObjectKey())
                .put("status", record.getStatus().name())
                .put("createdAt", record.getCreatedAt().toString())
                .put("updatedAt", record.getUpdatedAt().toString());
        record.getDisplayName().ifPresent(name -> json.put("displayName", name));
        record.getSize().ifPresent(size -> json.put("size", size));
        record.getDigest().ifPresent(digest -> json.put("digest", digest));
        record.getCredentialExpiry().ifPresent(expiry -> json.put("credentialExpiry", expiry.toString()));
        record.getFailureReason().ifPresent(reason -> json.put("failureReason", new JsonObject()
                .put("category", reason.category().name())
                .put("detail", reason.detail())));
        if (!record.getMeta().isEmpty()) {
            json.put("meta", new JsonObject(record.getMeta()));
        }
        return json;
    }

    static JsonArray toJson(List<TransferRecord> records) {
        JsonArray array = new JsonArray();
        records.forEach(record -> array.add(toJson(record)));
        return array;
    }
}
