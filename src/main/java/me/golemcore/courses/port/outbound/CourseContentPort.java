package me.golemcore.courses.port.outbound;

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

import me.golemcore.courses.domain.model.CourseAnalytics;
import me.golemcore.courses.domain.model.CourseOutline;
import me.golemcore.courses.domain.model.SearchResults;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the course content store: semantic search over lesson chunks plus
 * catalog lookups.
 */
public interface CourseContentPort {

    /**
     * Searches course material. Store failures are reported through
     * {@link SearchResults#getError()}, never as a failed future.
     *
     * @param query
     *            what to search for
     * @param courseName
     *            optional course filter, may be partial; {@code null} for all
     * @param lessonNumber
     *            optional lesson filter; {@code null} for all
     */
    CompletableFuture<SearchResults> search(String query, String courseName, Integer lessonNumber);

    /**
     * Looks up a course outline by (possibly partial) name. Empty when no course
     * matches.
     */
    CompletableFuture<Optional<CourseOutline>> outline(String courseName);

    CompletableFuture<CourseAnalytics> analytics();

    boolean isAvailable();
}
