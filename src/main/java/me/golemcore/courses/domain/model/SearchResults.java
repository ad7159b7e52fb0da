package me.golemcore.courses.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Result of a content-store search. Documents and metadata are parallel
 * lists; a non-null error means the search itself failed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResults {

    @Builder.Default
    private List<String> documents = List.of();
    @Builder.Default
    private List<ChunkMetadata> metadata = List.of();
    private String error;

    public static SearchResults empty() {
        return SearchResults.builder().build();
    }

    public static SearchResults error(String error) {
        return SearchResults.builder().error(error).build();
    }

    public boolean hasError() {
        return error != null && !error.isBlank();
    }

    public boolean isEmpty() {
        return documents == null || documents.isEmpty();
    }
}
