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
package org.sqlvault.backup;

/**
 * Renders JDBC values as SQL literals for dump scripts.
 */
public final class SqlLiteral {

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private SqlLiteral() {
    }

    public static String render(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof String string) {
            return quote(string);
        }
        if (value instanceof byte[] bytes) {
            return renderBlob(bytes);
        }
        if (value instanceof Boolean bool) {
            return bool ? "1" : "0";
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (Double.isNaN(number)) {
                return "NULL";
            }
            if (Double.isInfinite(number)) {
                return number > 0 ? "9e999" : "-9e999";
            }
            return String.valueOf(value);
        }
        if (value instanceof Number) {
            return String.valueOf(value);
        }
        return quote(String.valueOf(value));
    }

    public static String quote(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    public static String quoteIdentifier(String name) {
        return "\"" + name.replace("\"", "\"\"") + "\"";
    }

    private static String renderBlob(byte[] bytes) {
        StringBuilder builder = new StringBuilder(bytes.length * 2 + 3);
        builder.append("X'");
        for (byte b : bytes) {
            builder.append(HEX[(b >> 4) & 0x0F]).append(HEX[b & 0x0F]);
        }
        return builder.append('\'').toString();
    }

}
