package me.golemcore.courses.adapter.outbound.content;

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.courses.domain.model.ChunkMetadata;
import me.golemcore.courses.domain.model.CourseAnalytics;
import me.golemcore.courses.domain.model.CourseOutline;
import me.golemcore.courses.domain.model.SearchResults;
import me.golemcore.courses.infrastructure.config.CourseAssistantProperties;
import me.golemcore.courses.port.outbound.CourseContentPort;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Course content adapter, talks to the course retrieval service over HTTP.
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>POST /search - Semantic search over lesson chunks
 * <li>GET /courses/outline?course_name= - Course outline, 404 when unknown
 * <li>GET /courses - Catalog statistics
 * </ul>
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code courses.content.url} - Service base URL
 * <li>{@code courses.content.api-key} - Optional bearer token
 * <li>{@code courses.content.timeout-seconds} - HTTP timeout
 * </ul>
 */
@Component
@Slf4j
public class HttpCourseContentAdapter implements CourseContentPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int HTTP_NOT_FOUND = 404;

    static final String NOT_CONFIGURED = "Course search is not configured";

    private final CourseAssistantProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpCourseContentAdapter(CourseAssistantProperties properties, OkHttpClient baseHttpClient,
            ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;

        int timeoutSeconds = properties.getContent().getTimeoutSeconds();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public CompletableFuture<SearchResults> search(String query, String courseName, Integer lessonNumber) {
        if (!isAvailable()) {
            return CompletableFuture.completedFuture(SearchResults.error(NOT_CONFIGURED));
        }

        String body;
        try {
            body = objectMapper.writeValueAsString(new SearchRequest(query, courseName, lessonNumber));
        } catch (JsonProcessingException e) {
            return CompletableFuture.completedFuture(SearchResults.error("Search error: " + e.getOriginalMessage()));
        }
        Request.Builder requestBuilder = new Request.Builder()
                .url(baseUrl() + "/search")
                .post(RequestBody.create(body, JSON));
        addApiKeyHeader(requestBuilder);

        return submit(requestBuilder.build(), call -> {
            try (Response response = call.execute()) {
                ResponseBody responseBody = response.body();
                if (!response.isSuccessful() || responseBody == null) {
                    log.warn("[Content] Search failed: HTTP {}", response.code());
                    return SearchResults.error("Search error: HTTP " + response.code());
                }
                return toSearchResults(objectMapper.readValue(responseBody.string(), SearchResponse.class));
            } catch (JsonProcessingException e) {
                log.warn("[Content] Unreadable search response: {}", e.getOriginalMessage());
                return SearchResults.error("Search error: unreadable response from content service");
            } catch (IOException e) {
                log.warn("[Content] Search error: {}", e.getMessage());
                return SearchResults.error("Search error: " + e.getMessage());
            }
        });
    }

    @Override
    public CompletableFuture<Optional<CourseOutline>> outline(String courseName) {
        if (!isAvailable()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }

        HttpUrl url = HttpUrl.get(baseUrl() + "/courses/outline").newBuilder()
                .addQueryParameter("course_name", courseName)
                .build();
        Request.Builder requestBuilder = new Request.Builder().url(url).get();
        addApiKeyHeader(requestBuilder);

        return submit(requestBuilder.build(), call -> {
            try (Response response = call.execute()) {
                if (response.code() == HTTP_NOT_FOUND) {
                    log.debug("[Content] No outline for '{}'", courseName);
                    return Optional.empty();
                }
                String body = successfulBody(response, "Outline lookup");
                return Optional.of(toOutline(objectMapper.readValue(body, OutlineResponse.class)));
            } catch (IOException e) {
                log.warn("[Content] Outline error: {}", e.getMessage());
                throw e;
            }
        });
    }

    @Override
    public CompletableFuture<CourseAnalytics> analytics() {
        if (!isAvailable()) {
            return CompletableFuture.completedFuture(CourseAnalytics.empty());
        }

        Request.Builder requestBuilder = new Request.Builder().url(baseUrl() + "/courses").get();
        addApiKeyHeader(requestBuilder);

        return submit(requestBuilder.build(), call -> {
            try (Response response = call.execute()) {
                String body = successfulBody(response, "Catalog lookup");
                CatalogResponse catalog = objectMapper.readValue(body, CatalogResponse.class);
                return new CourseAnalytics(catalog.totalCourses(), catalog.courseTitles());
            } catch (IOException e) {
                log.warn("[Content] Catalog error: {}", e.getMessage());
                throw e;
            }
        });
    }

    /**
     * Runs the call off the caller's thread. Cancelling the returned future
     * cancels the HTTP call; an {@link IOException} fails the future with an
     * {@link UncheckedIOException}.
     */
    private <T> CompletableFuture<T> submit(Request request, CallHandler<T> handler) {
        Call call = httpClient.newCall(request);
        CompletableFuture<T> future = CompletableFuture.supplyAsync(() -> {
            try {
                return handler.handle(call);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
        future.whenComplete((value, error) -> {
            if (future.isCancelled()) {
                log.debug("[Content] Cancelling {} {}", request.method(), request.url().encodedPath());
                call.cancel();
            }
        });
        return future;
    }

    @Override
    public boolean isAvailable() {
        String url = properties.getContent().getUrl();
        return url != null && !url.isBlank();
    }

    private String baseUrl() {
        String url = properties.getContent().getUrl();
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private void addApiKeyHeader(Request.Builder builder) {
        String apiKey = properties.getContent().getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
    }

    private static String successfulBody(Response response, String operation) throws IOException {
        ResponseBody responseBody = response.body();
        if (!response.isSuccessful() || responseBody == null) {
            throw new IOException(operation + " failed: HTTP " + response.code());
        }
        return responseBody.string();
    }

    private static SearchResults toSearchResults(SearchResponse response) {
        if (response.error() != null && !response.error().isBlank()) {
            return SearchResults.error(response.error());
        }
        List<String> documents = response.documents() != null ? response.documents() : List.of();
        List<ChunkMetadata> metadata = new ArrayList<>();
        if (response.metadata() != null) {
            for (ChunkMetadataDto dto : response.metadata()) {
                metadata.add(ChunkMetadata.builder()
                        .courseTitle(dto.courseTitle())
                        .lessonNumber(dto.lessonNumber())
                        .lessonLink(dto.lessonLink())
                        .build());
            }
        }
        return SearchResults.builder()
                .documents(List.copyOf(documents))
                .metadata(metadata)
                .build();
    }

    private static CourseOutline toOutline(OutlineResponse response) {
        List<CourseOutline.Lesson> lessons = new ArrayList<>();
        if (response.lessons() != null) {
            for (LessonDto lesson : response.lessons()) {
                lessons.add(CourseOutline.Lesson.builder()
                        .number(lesson.lessonNumber())
                        .title(lesson.lessonTitle())
                        .link(lesson.lessonLink())
                        .build());
            }
        }
        return CourseOutline.builder()
                .title(response.title())
                .courseLink(response.courseLink())
                .instructor(response.instructor())
                .lessons(lessons)
                .build();
    }

    @FunctionalInterface
    private interface CallHandler<T> {
        T handle(Call call) throws IOException;
    }

    // Wire DTOs
    record SearchRequest(String query, @JsonProperty("course_name") String courseName,
            @JsonProperty("lesson_number") Integer lessonNumber) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SearchResponse(List<String> documents, List<ChunkMetadataDto> metadata, String error) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChunkMetadataDto(@JsonProperty("course_title") String courseTitle,
            @JsonProperty("lesson_number") Integer lessonNumber,
            @JsonProperty("lesson_link") String lessonLink) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record OutlineResponse(String title, @JsonProperty("course_link") String courseLink, String instructor,
            List<LessonDto> lessons) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record LessonDto(@JsonProperty("lesson_number") int lessonNumber,
            @JsonProperty("lesson_title") String lessonTitle,
            @JsonProperty("lesson_link") String lessonLink) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CatalogResponse(@JsonProperty("total_courses") int totalCourses,
            @JsonProperty("course_titles") List<String> courseTitles) {
    }
}
