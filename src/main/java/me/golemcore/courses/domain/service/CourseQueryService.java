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
import me.golemcore.courses.domain.model.CourseAnalytics;
import me.golemcore.courses.domain.model.QueryAnswer;
import me.golemcore.courses.domain.system.toolloop.ToolLoopSystem;
import me.golemcore.courses.port.outbound.CourseContentPort;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point for answering questions about the course catalog.
 *
 * <p>
 * The tool registry is shared, so a whole query cycle (reset, answer, read
 * sources) runs under a fair lock. Concurrent questions are answered one at a
 * time in arrival order.
 */
@Service
@Slf4j
public class CourseQueryService {

    static final String PROMPT_PREFIX = "Answer this question about course materials: ";

    private final ToolLoopSystem toolLoopSystem;
    private final ToolRegistry toolRegistry;
    private final SessionService sessionService;
    private final CourseContentPort contentPort;
    private final ReentrantLock queryLock = new ReentrantLock(true);

    public CourseQueryService(ToolLoopSystem toolLoopSystem, ToolRegistry toolRegistry,
            SessionService sessionService, CourseContentPort contentPort) {
        this.toolLoopSystem = toolLoopSystem;
        this.toolRegistry = toolRegistry;
        this.sessionService = sessionService;
        this.contentPort = contentPort;
    }

    public QueryAnswer query(String query, String sessionId) {
        String effectiveSessionId = sessionId != null && !sessionId.isBlank()
                ? sessionId
                : sessionService.createSession();
        String history = sessionService.getConversationHistory(effectiveSessionId);

        String answer;
        List<String> sources;
        queryLock.lock();
        try {
            toolRegistry.reset();
            answer = toolLoopSystem.respond(PROMPT_PREFIX + query, history, toolRegistry.definitions(),
                    toolRegistry);
            sources = toolRegistry.allSources();
            log.debug("[Query] {}", toolRegistry.sequentialSummary());
        } finally {
            queryLock.unlock();
        }

        sessionService.addExchange(effectiveSessionId, query, answer);
        log.debug("[Query] Answered in session {} with {} source(s)", effectiveSessionId, sources.size());
        return new QueryAnswer(answer, sources, effectiveSessionId);
    }

    /**
     * Catalog statistics. Degrades to an empty catalog when the content service
     * cannot be reached.
     */
    public CourseAnalytics courseAnalytics() {
        try {
            return contentPort.analytics().join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Query] Course analytics unavailable: {}", cause.getMessage());
            return CourseAnalytics.empty();
        }
    }

    public void clearSession(String sessionId) {
        sessionService.clearSession(sessionId);
    }
}
