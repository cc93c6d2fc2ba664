package me.golemcore.biblebot.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of a passage lookup: either the passage, or a failure kind plus a
 * diagnostic detail that is logged and never shown to room members.
 */
@Data
@Builder
public class PassageResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isFound()
    private boolean found;
    private Passage passage;
    private PassageFailureKind failureKind;
    private String detail;

    public static PassageResult found(Passage passage) {
        return PassageResult.builder()
                .found(true)
                .passage(passage)
                .build();
    }

    public static PassageResult failure(PassageFailureKind kind, String detail) {
        return PassageResult.builder()
                .found(false)
                .failureKind(kind)
                .detail(detail)
                .build();
    }

    public static PassageResult notFound(String detail) {
        return failure(PassageFailureKind.NOT_FOUND, detail);
    }

    public static PassageResult unavailable(String detail) {
        return failure(PassageFailureKind.UNAVAILABLE, detail);
    }
}
