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

/**
 * Instructions sent with every completion request.
 */
public final class InstructionPrompt {

    static final String INSTRUCTIONS = """
            You are an assistant for course materials and educational content. You can search \
            the course catalog with the tools provided.

            Tool usage:
            - Search only for questions about specific course content or lesson material.
            - Use the outline tool for questions about a course's structure, link or lesson list.
            - You may search at most twice in sequence. Start broad, then narrow down using what \
            the first search returned.
            - Build the answer from what the searches return. If nothing relevant is found, say so.

            Answering:
            - Answer general knowledge questions directly without searching.
            - Give the answer only. Do not describe your reasoning or your searches, and do not \
            write phrases such as "based on the search results".
            - Keep answers educational and well organized, adding an example where it helps \
            understanding.
            """;

    static final String HISTORY_HEADER = "\n\nPrevious conversation:\n";

    private InstructionPrompt() {
    }

    public static String build(String history) {
        if (history == null || history.isBlank()) {
            return INSTRUCTIONS;
        }
        return INSTRUCTIONS + HISTORY_HEADER + history;
    }
}
