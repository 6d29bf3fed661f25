/*
 * Copyright 2026
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
package org.sqlvault.helper;

import java.util.Locale;

public final class FormatUtil {

    private static final String[] UNITS = {"B", "KB", "MB", "GB"};

    private FormatUtil() {
    }

    public static String formatSize(long bytes) {
        double size = bytes;
        int unitIndex = 0;
        while (size >= 1024 && unitIndex < UNITS.length - 1) {
            size /= 1024;
            unitIndex++;
        }
        return String.format(Locale.ROOT, "%.1f%s", size, UNITS[unitIndex]);
    }

}
