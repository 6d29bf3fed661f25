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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

public final class GzipUtil {

    private GzipUtil() {
    }

    public static byte[] compress(byte[] data) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(Math.max(32, data.length / 4));
        try (OutputStream output = new GZIPOutputStream(buffer)) {
            output.write(data);
        }
        return buffer.toByteArray();
    }

    public static byte[] decompress(byte[] data) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(data.length * 4);
        try (InputStream input = new GZIPInputStream(new ByteArrayInputStream(data))) {
            input.transferTo(buffer);
        }
        return buffer.toByteArray();
    }

}
