package me.golemcore.courses.domain.system.toolloop;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.courses.domain.model.Message;

import java.util.List;

/**
 * Local heuristic that estimates the size of a conversation before it is sent
 * again. A turn counts its text plus the JSON form of any tool calls or tool
 * results it carries.
 */
@Slf4j
public class ConversationSizeGuard {

    private final ObjectMapper objectMapper;
    private final int maxChars;

    public ConversationSizeGuard(ObjectMapper objectMapper, int maxChars) {
        if (maxChars <= 0) {
            throw new IllegalStateException("max-conversation-chars must be positive, got " + maxChars);
        }
        this.objectMapper = objectMapper;
        this.maxChars = maxChars;
    }

    public int measure(List<Message> conversation) {
        int total = 0;
        for (Message message : conversation) {
            if (message.getContent() != null) {
                total += message.getContent().length();
            }
            if (message.hasToolCalls()) {
                total += serializedLength(message.getToolCalls());
            }
            if (message.hasToolResults()) {
                total += serializedLength(message.getToolResults());
            }
        }
        return total;
    }

    public boolean exceeds(int measuredChars) {
        return measuredChars > maxChars;
    }

    public int getMaxChars() {
        return maxChars;
    }

    private int serializedLength(Object value) {
        try {
            return objectMapper.writeValueAsString(value).length();
        } catch (JsonProcessingException e) {
            log.debug("[ToolLoop] Falling back to toString() for size estimate: {}", e.getMessage());
            return String.valueOf(value).length();
        }
    }
}
