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

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns an arbitrary display name into a safe object-key segment.
 *
 * <p>The result always matches {@code ^[a-z0-9._-]{1,128}$}. Sanitizing an already
 * sanitized name returns it unchanged.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class FilenameSanitizer {

    public static final String FALLBACK_NAME = "file";
    public static final int MAX_LENGTH = 128;

    private static final Pattern PATH_SEPARATORS = Pattern.compile("[/\\\\]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern DISALLOWED = Pattern.compile("[^A-Za-z0-9._-]");

    private FilenameSanitizer() {
    }

    public static String sanitize(String name) {
        if (name == null || name.isEmpty()) {
            return FALLBACK_NAME;
        }

        // split() drops trailing empty segments, so "dir/" yields ["dir"]; check the tail explicitly
        String lastChar = name.substring(name.length() - 1);
        if (PATH_SEPARATORS.matcher(lastChar).matches()) {
            return FALLBACK_NAME;
        }
        String[] segments = PATH_SEPARATORS.split(name);
        String base = segments.length == 0 ? "" : segments[segments.length - 1];

        String cleaned = WHITESPACE.matcher(base).replaceAll("_");
        cleaned = DISALLOWED.matcher(cleaned).replaceAll("");
        cleaned = cleaned.toLowerCase(Locale.ROOT);
        if (cleaned.length() > MAX_LENGTH) {
            cleaned = cleaned.substring(0, MAX_LENGTH);
        }
        return cleaned.isEmpty() ? FALLBACK_NAME : cleaned;
    }
}
