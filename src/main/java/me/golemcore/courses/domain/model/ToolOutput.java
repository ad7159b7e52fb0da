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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * What a tool hands back for one invocation. Sources are the provenance
 * strings of the material the output was built from, in the order they
 * appear.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName")
public class ToolOutput {

    private boolean success;
    private String output;
    private String error;
    @Builder.Default
    private List<String> sources = List.of();

    public static ToolOutput success(String output) {
        return success(output, List.of());
    }

    public static ToolOutput success(String output, List<String> sources) {
        return ToolOutput.builder()
                .success(true)
                .output(output)
                .sources(sources != null ? List.copyOf(sources) : List.of())
                .build();
    }

    public static ToolOutput failure(String error) {
        return ToolOutput.builder()
                .success(false)
                .error(error)
                .build();
    }

    /**
     * Text fed back to the model for this invocation.
     */
    public String text() {
        if (success) {
            return output != null ? output : "";
        }
        return error != null && !error.isBlank() ? error : "Tool execution failed";
    }
}
