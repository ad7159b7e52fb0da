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

import me.golemcore.courses.domain.model.LlmRequest;
import me.golemcore.courses.domain.model.LlmResponse;
import me.golemcore.courses.domain.model.Message;
import me.golemcore.courses.domain.model.ToolChoice;
import me.golemcore.courses.domain.model.ToolDefinition;
import me.golemcore.courses.domain.model.ToolOutput;
import me.golemcore.courses.domain.model.ToolResult;
import me.golemcore.courses.domain.service.ToolRegistry;
import me.golemcore.courses.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Tool loop orchestrator.
 *
 * <p>
 * One invocation runs as an explicit state machine:
 * {@code INIT -> AWAITING_COMPLETION -> (DIRECT_ANSWER | TOOL_ROUND)}, then
 * {@code EXECUTING_TOOLS -> AWAITING_FOLLOWUP -> (DIRECT_ANSWER | TOOL_ROUND | ROUND_LIMIT)}
 * for every tool round, until {@code DONE} or {@code FAILED}.
 *
 * <p>
 * Tools are advertised on the first request only. After a round the model is
 * asked to continue without tools; if it still wants tools and the round limit
 * allows it, tools are re-attached for exactly one follow-up request whose tool
 * calls become the next round. Once the limit is reached a final request
 * without tools forces an answer. Completion failures never propagate: the
 * first request fails with an apology, later ones with a summary of the tool
 * results gathered so far.
 */
public class DefaultToolLoopSystem implements ToolLoopSystem {

    private static final Logger log = LoggerFactory.getLogger(DefaultToolLoopSystem.class);

    static final String APOLOGY_TEMPLATE = "I encountered an error while processing your question: %s. "
            + "Please try rephrasing your question.";

    private final LlmPort llmPort;
    private final ConversationSizeGuard sizeGuard;
    private final ToolResultSummarizer summarizer;
    private final int maxRounds;

    public DefaultToolLoopSystem(LlmPort llmPort, ConversationSizeGuard sizeGuard, ToolResultSummarizer summarizer,
            int maxRounds) {
        if (maxRounds <= 0) {
            throw new IllegalStateException("max-rounds must be positive, got " + maxRounds);
        }
        this.llmPort = llmPort;
        this.sizeGuard = sizeGuard;
        this.summarizer = summarizer;
        this.maxRounds = maxRounds;
    }

    @Override
    public ToolLoopTurnResult process(String query, String history, List<ToolDefinition> tools,
            ToolRegistry registry) {
        Invocation invocation = new Invocation(InstructionPrompt.build(history),
                tools != null ? List.copyOf(tools) : List.of(), registry, new RoundState(maxRounds));
        invocation.conversation.add(Message.user(query));

        ToolLoopState state = ToolLoopState.INIT;
        while (!state.isTerminal()) {
            ToolLoopState next = step(invocation, state);
            log.debug("[ToolLoop] {} -> {} (round {}/{})", state, next, invocation.rounds.round(), maxRounds);
            state = next;
        }

        RoundState rounds = invocation.rounds;
        log.debug("[ToolLoop] Finished in {}: rounds={}, llmCalls={}, toolExecutions={}",
                state, rounds.round(), rounds.llmCalls(), rounds.toolExecutions());
        String text = invocation.answer != null ? invocation.answer : "";
        return new ToolLoopTurnResult(text, state, rounds.round(), rounds.llmCalls(), rounds.toolExecutions());
    }

    private ToolLoopState step(Invocation invocation, ToolLoopState state) {
        return switch (state) {
        case INIT -> ToolLoopState.AWAITING_COMPLETION;
        case AWAITING_COMPLETION -> awaitInitialCompletion(invocation);
        case DIRECT_ANSWER -> {
            invocation.answer = textOf(invocation.current);
            yield ToolLoopState.DONE;
        }
        case TOOL_ROUND -> {
            LlmResponse response = invocation.current;
            invocation.conversation.add(Message.assistant(response.getContent(), response.getToolCalls()));
            yield ToolLoopState.EXECUTING_TOOLS;
        }
        case EXECUTING_TOOLS -> executeTools(invocation);
        case AWAITING_FOLLOWUP -> awaitFollowup(invocation);
        case ROUND_LIMIT -> forceClosure(invocation);
        case DONE, FAILED -> state;
        };
    }

    private ToolLoopState awaitInitialCompletion(Invocation invocation) {
        LlmResponse response;
        try {
            response = complete(invocation, true);
        } catch (CompletionFailedException e) {
            log.warn("[ToolLoop] First completion request failed: {}", e.getMessage());
            invocation.answer = String.format(APOLOGY_TEMPLATE, e.getMessage());
            return ToolLoopState.FAILED;
        }
        invocation.current = response;
        if (!response.requestsToolUse() || invocation.registry == null) {
            return ToolLoopState.DIRECT_ANSWER;
        }
        return ToolLoopState.TOOL_ROUND;
    }

    private ToolLoopState executeTools(Invocation invocation) {
        List<ToolResult> results = new ArrayList<>();
        for (Message.ToolCall call : invocation.current.getToolCalls()) {
            ToolOutput output;
            try {
                output = invocation.registry.execute(call.getName(), call.getArguments());
            } catch (RuntimeException e) {
                output = ToolOutput.failure("Tool execution failed: " + e.getMessage());
            }
            results.add(ToolResult.of(call, output));
        }
        invocation.conversation.add(Message.toolResults(results));

        RoundState rounds = invocation.rounds;
        rounds.completeRound(results);
        rounds.recordConversationChars(sizeGuard.measure(invocation.conversation));
        log.debug("[ToolLoop] Round {} executed {} tool call(s), conversation is {} chars",
                rounds.round(), results.size(), rounds.conversationChars());

        if (sizeGuard.exceeds(rounds.conversationChars())) {
            log.warn("[ToolLoop] Conversation size {} exceeds {} chars, summarizing",
                    rounds.conversationChars(), sizeGuard.getMaxChars());
            invocation.answer = summarizer.afterSizeLimit(rounds.collectedResults());
            return ToolLoopState.DONE;
        }
        return rounds.isLimitReached() ? ToolLoopState.ROUND_LIMIT : ToolLoopState.AWAITING_FOLLOWUP;
    }

    private ToolLoopState awaitFollowup(Invocation invocation) {
        RoundState rounds = invocation.rounds;
        try {
            LlmResponse continuation = complete(invocation, false);
            invocation.current = continuation;
            if (!continuation.requestsToolUse() || invocation.tools.isEmpty()) {
                return ToolLoopState.DIRECT_ANSWER;
            }
            if (!rounds.tryClaimFollowup()) {
                log.warn("[ToolLoop] Model still wants tools after round {}, closing with its answer",
                        rounds.round());
                return closeWith(invocation, continuation);
            }

            log.debug("[ToolLoop] Model wants another round, re-attaching tools for one follow-up");
            LlmResponse followup = complete(invocation, true);
            invocation.current = followup;
            return followup.requestsToolUse() ? ToolLoopState.TOOL_ROUND : ToolLoopState.DIRECT_ANSWER;
        } catch (CompletionFailedException e) {
            log.warn("[ToolLoop] Completion request failed after round {}: {}", rounds.round(), e.getMessage());
            invocation.answer = summarizer.afterTransportFailure(rounds.collectedResults());
            return ToolLoopState.FAILED;
        }
    }

    private ToolLoopState forceClosure(Invocation invocation) {
        RoundState rounds = invocation.rounds;
        log.warn("[ToolLoop] Reached {} tool round(s), forcing a final answer", rounds.round());
        try {
            LlmResponse closure = complete(invocation, false);
            invocation.current = closure;
            return closeWith(invocation, closure);
        } catch (CompletionFailedException e) {
            log.warn("[ToolLoop] Final completion request failed: {}", e.getMessage());
            invocation.answer = summarizer.afterRoundLimit(rounds.collectedResults());
            return ToolLoopState.FAILED;
        }
    }

    private ToolLoopState closeWith(Invocation invocation, LlmResponse closure) {
        String text = textOf(closure);
        invocation.answer = text.isBlank()
                ? summarizer.afterRoundLimit(invocation.rounds.collectedResults())
                : text;
        return ToolLoopState.DONE;
    }

    private LlmResponse complete(Invocation invocation, boolean attachTools) {
        LlmRequest.LlmRequestBuilder builder = LlmRequest.builder()
                .systemPrompt(invocation.systemPrompt)
                .messages(new ArrayList<>(invocation.conversation));
        if (attachTools && !invocation.tools.isEmpty()) {
            builder.tools(invocation.tools).toolChoice(ToolChoice.AUTO);
        }

        invocation.rounds.recordLlmCall();
        LlmResponse response;
        try {
            response = llmPort.chat(builder.build()).join();
        } catch (CompletionException | CancellationException e) {
            throw new CompletionFailedException(unwrap(e));
        } catch (RuntimeException e) {
            throw new CompletionFailedException(e);
        }
        if (response == null) {
            throw new CompletionFailedException(new IllegalStateException("empty response from completion service"));
        }
        return response;
    }

    private static String textOf(LlmResponse response) {
        return response != null && response.getContent() != null ? response.getContent() : "";
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cursor = error;
        while ((cursor instanceof CompletionException || cursor instanceof ExecutionException)
                && cursor.getCause() != null) {
            cursor = cursor.getCause();
        }
        return cursor;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return message;
    }

    private static final class Invocation {
        private final String systemPrompt;
        private final List<ToolDefinition> tools;
        private final ToolRegistry registry;
        private final RoundState rounds;
        private final List<Message> conversation = new ArrayList<>();
        private LlmResponse current;
        private String answer;

        private Invocation(String systemPrompt, List<ToolDefinition> tools, ToolRegistry registry,
                RoundState rounds) {
            this.systemPrompt = systemPrompt;
            this.tools = tools;
            this.registry = registry;
            this.rounds = rounds;
        }
    }

    /**
     * A completion request that did not produce a response. The message names
     * the underlying cause.
     */
    private static final class CompletionFailedException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        private CompletionFailedException(Throwable cause) {
            super(describe(cause), cause);
        }
    }
}
