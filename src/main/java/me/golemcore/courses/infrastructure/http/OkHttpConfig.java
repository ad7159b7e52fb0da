package me.golemcore.courses.infrastructure.http;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.courses.infrastructure.config.CourseAssistantProperties;
import okhttp3.ConnectionPool;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Shared {@link OkHttpClient} for outbound HTTP adapters. Adapters derive their
 * own clients from it with {@code newBuilder()} so the connection pool is
 * reused.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class OkHttpConfig {

    private final CourseAssistantProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        CourseAssistantProperties.HttpProperties http = properties.getHttp();

        return new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeout())
                .readTimeout(http.getReadTimeout())
                .writeTimeout(http.getWriteTimeout())
                .connectionPool(new ConnectionPool(
                        http.getMaxIdleConnections(),
                        http.getKeepAlive().toMillis(),
                        TimeUnit.MILLISECONDS))
                .retryOnConnectionFailure(http.isRetryOnConnectionFailure())
                .addInterceptor(new TimingInterceptor())
                .build();
    }

    /**
     * Logs method, path, status and latency of every outbound call at DEBUG.
     */
    static final class TimingInterceptor implements Interceptor {

        @Override
        public Response intercept(Chain chain) throws IOException {
            Request request = chain.request();
            long startedAt = System.nanoTime();
            Response response = chain.proceed(request);
            if (log.isDebugEnabled()) {
                long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
                log.debug("[Http] {} {} -> {} in {}ms", request.method(), request.url().encodedPath(),
                        response.code(), elapsedMs);
            }
            return response;
        }
    }
}
