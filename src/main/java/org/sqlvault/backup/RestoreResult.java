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

import java.util.List;

public record RestoreResult(
        boolean success,
        List<String> restoredTables,
        long restoredRecords,
        FailureReason reason,
        String error,
        long duration) {

    public static RestoreResult success(List<String> tables, long records, long duration) {
        return new RestoreResult(true, List.copyOf(tables), records, null, null, duration);
    }

    public static RestoreResult failure(FailureReason reason, String error, long duration) {
        return new RestoreResult(false, List.of(), 0, reason, error, duration);
    }

}
