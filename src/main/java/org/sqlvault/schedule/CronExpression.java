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
package org.sqlvault.schedule;

import java.time.LocalDateTime;
import java.util.BitSet;

/**
 * Five field cron expression: minute, hour, day of month, month and day of week.
 * <p>
 * Each field accepts {@code *}, numbers, lists ({@code 1,15}), ranges ({@code 1-5}) and steps ({@code *}{@code /15},
 * {@code 0-30/10}). Day of week is 0-7 where both 0 and 7 mean Sunday. An expression with a malformed field is kept
 * but never matches.
 */
public final class CronExpression {

    private static final int[][] RANGES = {
            {0, 59},
            {0, 23},
            {1, 31},
            {1, 12},
            {0, 7},
    };

    private final String expression;
    private final BitSet[] fields = new BitSet[5];
    private final String error;

    private CronExpression(String expression) {
        this.expression = expression;
        this.error = parseFields(expression);
    }

    public static CronExpression parse(String expression) {
        return new CronExpression(expression);
    }

    public String getExpression() {
        return expression;
    }

    public boolean isValid() {
        return error == null;
    }

    public String getError() {
        return error;
    }

    public boolean matches(LocalDateTime time) {
        if (error != null) {
            return false;
        }
        int dayOfWeek = time.getDayOfWeek().getValue() % 7;
        return fields[0].get(time.getMinute())
                && fields[1].get(time.getHour())
                && fields[2].get(time.getDayOfMonth())
                && fields[3].get(time.getMonthValue())
                && fields[4].get(dayOfWeek);
    }

    private String parseFields(String value) {
        if (value == null || value.isBlank()) {
            return "Empty cron expression";
        }
        String[] parts = value.trim().split("\\s+");
        if (parts.length != fields.length) {
            return "Expected 5 fields but found " + parts.length;
        }
        for (int i = 0; i < parts.length; i++) {
            BitSet field = parseField(parts[i], RANGES[i][0], RANGES[i][1]);
            if (field == null) {
                return "Invalid field " + (i + 1) + ": " + parts[i];
            }
            if (i == 4 && field.get(7)) {
                field.set(0);
            }
            fields[i] = field;
        }
        return null;
    }

    private static BitSet parseField(String field, int min, int max) {
        BitSet result = new BitSet(max + 1);
        for (String item : field.split(",", -1)) {
            int step = 1;
            String range = item;
            int slash = item.indexOf('/');
            if (slash >= 0) {
                step = parseNumber(item.substring(slash + 1), 1, max);
                range = item.substring(0, slash);
            }
            int start;
            int end;
            if (range.equals("*")) {
                start = min;
                end = max;
            } else {
                int dash = range.indexOf('-');
                if (dash > 0) {
                    start = parseNumber(range.substring(0, dash), min, max);
                    end = parseNumber(range.substring(dash + 1), min, max);
                } else {
                    start = parseNumber(range, min, max);
                    end = slash >= 0 ? max : start;
                }
            }
            if (step < 0 || start < 0 || end < 0 || start > end) {
                return null;
            }
            for (int i = start; i <= end; i += step) {
                result.set(i);
            }
        }
        return result;
    }

    private static int parseNumber(String value, int min, int max) {
        try {
            int number = Integer.parseInt(value);
            return number >= min && number <= max ? number : -1;
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    @Override
    public String toString() {
        return expression;
    }

}
