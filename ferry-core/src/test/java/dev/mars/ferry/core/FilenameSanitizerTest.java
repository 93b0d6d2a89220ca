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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FilenameSanitizer")
class FilenameSanitizerTest {

    private static final Pattern SAFE = Pattern.compile("^[a-z0-9._-]{1,128}$");

    @Nested
    @DisplayName("Fallback")
    class Fallback {

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"/", "\\", "dir/", "C:\\tmp\\", "!!!", "\u00e9\u00e8"})
        void unusableNamesFallBackToFile(String name) {
            assertThat(FilenameSanitizer.sanitize(name)).isEqualTo("file");
        }
    }

    @Nested
    @DisplayName("Cleaning")
    class Cleaning {

        @ParameterizedTest(name = "''{0}'' -> ''{1}''")
        @CsvSource(delimiter = '|', value = {
                "report.csv|report.csv",
                "/var/log/app/Report.CSV|report.csv",
                "C:\\Users\\me\\My File.txt|my_file.txt",
                "../../etc/passwd|passwd",
                "a   b\tc.log|a_b_c.log",
                "data(1)#final!.tar.gz|data1final.tar.gz",
                "Q3 Results - Final.xlsx|q3_results_-_final.xlsx"
        })
        void producesSafeBaseName(String input, String expected) {
            assertThat(FilenameSanitizer.sanitize(input)).isEqualTo(expected);
        }

        @Test
        void truncatesTo128Characters() {
            String longName = "A".repeat(200) + ".bin";

            String result = FilenameSanitizer.sanitize(longName);

            assertThat(result).hasSize(128).isEqualTo("a".repeat(128));
        }
    }

    @Nested
    @DisplayName("Properties")
    class Properties {

        @ParameterizedTest
        @ValueSource(strings = {
                "report.csv", "/a/b/C D.txt", "x\\y\\..", "  spaced  out  ", "\u00fcber.txt",
                "tab\tand\nnewline", "....", "---___", "Mixed.Case.NAME"
        })
        void outputIsAlwaysSafe(String name) {
            assertThat(FilenameSanitizer.sanitize(name)).matches(SAFE);
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "report.csv", "/a/b/C D.txt", "\u00fcber.txt", "  spaced  out  ", "!!!", "Mixed.Case.NAME"
        })
        void isIdempotent(String name) {
            String once = FilenameSanitizer.sanitize(name);
            assertThat(FilenameSanitizer.sanitize(once)).isEqualTo(once);
        }
    }
}
