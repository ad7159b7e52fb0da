package me.golemcore.courses.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.courses.domain.model.ChatSession;
import me.golemcore.courses.infrastructure.config.CourseAssistantProperties;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory chat sessions. Each session keeps only the most recent exchanges,
 * which are rendered as plain text for the completion service instructions.
 */
@Service
@Slf4j
public class SessionService {

    private final Map<String, ChatSession> sessions = new ConcurrentHashMap<>();
    private final AtomicLong sessionCounter = new AtomicLong();
    private final int maxHistory;

    public SessionService(CourseAssistantProperties properties) {
        this.maxHistory = properties.getSession().getMaxHistory();
    }

    public String createSession() {
        String sessionId = "session_" + sessionCounter.incrementAndGet();
        sessions.put(sessionId, new ChatSession(sessionId, maxHistory));
        log.debug("[Query] Created session {}", sessionId);
        return sessionId;
    }

    /**
     * Stores one exchange, creating the session on first use.
     */
    public void addExchange(String sessionId, String userMessage, String assistantMessage) {
        sessions.computeIfAbsent(sessionId, id -> new ChatSession(id, maxHistory))
                .addExchange(userMessage, assistantMessage);
    }

    /**
     * Returns the retained exchanges as {@code User: ...} / {@code Assistant: ...}
     * lines, or {@code null} when the session is unknown or empty.
     */
    public String getConversationHistory(String sessionId) {
        if (sessionId == null) {
            return null;
        }
        ChatSession session = sessions.get(sessionId);
        if (session == null) {
            return null;
        }
        List<ChatSession.Exchange> exchanges = session.getExchanges();
        if (exchanges.isEmpty()) {
            return null;
        }
        return exchanges.stream()
                .map(exchange -> "User: " + exchange.userMessage() + "\nAssistant: " + exchange.assistantMessage())
                .collect(Collectors.joining("\n"));
    }

    public void clearSession(String sessionId) {
        ChatSession removed = sessions.remove(sessionId);
        if (removed != null) {
            removed.clear();
            log.debug("[Query] Cleared session {}", sessionId);
        }
    }
}
