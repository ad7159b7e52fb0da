package me.golemcore.courses.adapter.inbound.console;

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
import me.golemcore.courses.domain.model.CourseAnalytics;
import me.golemcore.courses.domain.model.QueryAnswer;
import me.golemcore.courses.domain.service.CourseQueryService;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Interactive console front end. Reads one question per line from stdin and
 * prints the answer with its sources.
 *
 * <p>
 * Commands: {@code /courses} lists the catalog, {@code /reset} starts a new
 * session, {@code /quit} exits.
 */
@Component
@ConditionalOnProperty(prefix = "courses.console", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class ConsoleChatRunner implements CommandLineRunner {

    static final String CMD_COURSES = "/courses";
    static final String CMD_RESET = "/reset";
    static final String CMD_QUIT = "/quit";

    private final CourseQueryService queryService;

    @Override
    public void run(String... args) throws IOException {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        PrintWriter out = new PrintWriter(System.out, true, StandardCharsets.UTF_8);
        chat(in, out);
    }

    void chat(BufferedReader in, PrintWriter out) throws IOException {
        out.println("Ask a question about the courses (" + CMD_COURSES + ", " + CMD_RESET + ", " + CMD_QUIT + ")");
        String sessionId = null;
        String line;
        while (true) {
            out.print("> ");
            out.flush();
            line = in.readLine();
            if (line == null) {
                break;
            }
            String input = line.strip();
            if (input.isEmpty()) {
                continue;
            }
            if (CMD_QUIT.equals(input)) {
                break;
            }
            if (CMD_RESET.equals(input)) {
                if (sessionId != null) {
                    queryService.clearSession(sessionId);
                }
                sessionId = null;
                out.println("Started a new session.");
                continue;
            }
            if (CMD_COURSES.equals(input)) {
                printAnalytics(queryService.courseAnalytics(), out);
                continue;
            }

            QueryAnswer answer = queryService.query(input, sessionId);
            sessionId = answer.sessionId();
            out.println(answer.answer());
            if (!answer.sources().isEmpty()) {
                out.println();
                out.println("Sources:");
                answer.sources().forEach(source -> out.println("- " + source));
            }
        }
        log.info("[Query] Console session finished");
    }

    private static void printAnalytics(CourseAnalytics analytics, PrintWriter out) {
        out.println("Courses: " + analytics.totalCourses());
        analytics.courseTitles().forEach(title -> out.println("- " + title));
    }
}
