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

import java.util.List;

/**
 * Catalog statistics: how many courses exist and their titles.
 */
public record CourseAnalytics(int totalCourses, List<String> courseTitles) {

    public CourseAnalytics {
        courseTitles = courseTitles != null ? List.copyOf(courseTitles) : List.of();
    }

    public static CourseAnalytics empty() {
        return new CourseAnalytics(0, List.of());
    }
}
