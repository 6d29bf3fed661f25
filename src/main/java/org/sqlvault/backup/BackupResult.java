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

public record BackupResult(
        boolean success,
        BackupMetadata metadata,
        FailureReason reason,
        String error,
        long duration) {

    public static BackupResult success(BackupMetadata metadata, long duration) {
        return new BackupResult(true, metadata, null, null, duration);
    }

    public static BackupResult failure(FailureReason reason, String error, long duration) {
        return new BackupResult(false, null, reason, error, duration);
    }

}
