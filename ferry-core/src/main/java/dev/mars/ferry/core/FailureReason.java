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

package dev.mars.ferry.core;

import java.util.Objects;

/**
 * A failure category together with the human-readable detail recorded for operators.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public record FailureReason(FailureCategory category, String detail) {

    public FailureReason {
        Objects.requireNonNull(category, "category cannot be null");
        if (detail == null || detail.isBlank()) {
            detail = category.defaultDetail();
        }
    }

    public static FailureReason of(FailureCategory category) {
        return new FailureReason(category, category.defaultDetail());
    }

    public static FailureReason of(FailureCategory category, String detail) {
        return new FailureReason(category, detail);
    }

    public static FailureReason sizeMismatch(long expected, long actual) {
        return new FailureReason(FailureCategory.SIZE_MISMATCH,
                String.format("size mismatch: expected %d bytes, store has %d bytes", expected, actual));
    }

    @Override
    public String toString() {
        return category.name() + ": " + detail;
    }
}
