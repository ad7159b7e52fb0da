package me.golemcore.courses.infrastructure.http;

import me.golemcore.courses.infrastructure.config.CourseAssistantProperties;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class OkHttpConfigTest {

    @Test
    void shouldApplyConfiguredTimeoutsAndRetryPolicy() {
        CourseAssistantProperties properties = new CourseAssistantProperties();
        properties.getHttp().setConnectTimeout(Duration.ofSeconds(3));
        properties.getHttp().setReadTimeout(Duration.ofSeconds(7));
        properties.getHttp().setRetryOnConnectionFailure(false);

        OkHttpClient client = new OkHttpConfig(properties).okHttpClient();

        assertEquals(3000, client.connectTimeoutMillis());
        assertEquals(7000, client.readTimeoutMillis());
        assertEquals(60000, client.writeTimeoutMillis());
        assertFalse(client.retryOnConnectionFailure());
        assertTrue(client.interceptors().stream().anyMatch(OkHttpConfig.TimingInterceptor.class::isInstance));
    }
}
