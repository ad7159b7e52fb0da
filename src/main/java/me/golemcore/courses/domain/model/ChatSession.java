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

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounded in-memory exchange history for one conversation. Only the most
 * recent exchanges are retained.
 */
public class ChatSession {

    @Getter
    private final String id;
    private final int maxExchanges;
    private final List<Exchange> exchanges = new ArrayList<>();

    public ChatSession(String id, int maxExchanges) {
        this.id = id;
        this.maxExchanges = maxExchanges;
    }

    public synchronized void addExchange(String userMessage, String assistantMessage) {
        exchanges.add(new Exchange(userMessage, assistantMessage));
        while (exchanges.size() > maxExchanges) {
            exchanges.remove(0);
        }
    }

    public synchronized List<Exchange> getExchanges() {
        return List.copyOf(exchanges);
    }

    public synchronized void clear() {
        exchanges.clear();
    }

    public record Exchange(String userMessage, String assistantMessage) {
    }
}
