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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Splits a dump script into executable statements.
 */
public final class SqlScript {

    private static final Pattern CONTROL_STATEMENT = Pattern.compile(
            "(?i)^(begin(\\s+(deferred|immediate|exclusive))?(\\s+transaction)?|commit(\\s+transaction)?"
                    + "|end(\\s+transaction)?|pragma\\s+foreign_keys\\s*=\\s*\\w+)$");

    private SqlScript() {
    }

    /**
     * Returns the statements of the script without comments, without the trailing semicolons and without the
     * transaction and foreign key statements that wrap the dump body.
     */
    public static List<String> statements(String script) {
        List<String> result = new ArrayList<>();
        for (String statement : split(script)) {
            if (!isControlStatement(statement)) {
                result.add(statement);
            }
        }
        return result;
    }

    static boolean isControlStatement(String statement) {
        String normalized = statement.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        return CONTROL_STATEMENT.matcher(normalized).matches();
    }

    static List<String> split(String script) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int length = script.length();
        int index = 0;
        while (index < length) {
            char ch = script.charAt(index);
            if (ch == '\'' || ch == '"' || ch == '`') {
                int end = findClosingQuote(script, index, ch);
                current.append(script, index, end);
                index = end;
            } else if (ch == '-' && index + 1 < length && script.charAt(index + 1) == '-') {
                int end = script.indexOf('\n', index);
                index = end < 0 ? length : end + 1;
                current.append('\n');
            } else if (ch == '/' && index + 1 < length && script.charAt(index + 1) == '*') {
                int end = script.indexOf("*/", index + 2);
                index = end < 0 ? length : end + 2;
                current.append(' ');
            } else if (ch == ';') {
                addStatement(statements, current);
                index++;
            } else {
                current.append(ch);
                index++;
            }
        }
        addStatement(statements, current);
        return statements;
    }

    private static int findClosingQuote(String script, int start, char quote) {
        int index = start + 1;
        while (index < script.length()) {
            if (script.charAt(index) == quote) {
                if (index + 1 < script.length() && script.charAt(index + 1) == quote) {
                    index += 2;
                    continue;
                }
                return index + 1;
            }
            index++;
        }
        return script.length();
    }

    private static void addStatement(List<String> statements, StringBuilder current) {
        String statement = current.toString().trim();
        if (!statement.isEmpty()) {
            statements.add(statement);
        }
        current.setLength(0);
    }

}
