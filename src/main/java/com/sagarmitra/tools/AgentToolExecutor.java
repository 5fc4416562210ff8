package com.sagarmitra.tools;

import com.sagarmitra.config.AgentProperties;
import com.sagarmitra.service.impl.dto.ToolCall;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Runs model-requested tool calls against the {@link ToolRegistry}. Every call yields exactly one
 * result: an unknown name, an exception, a timeout or a missing result becomes error text for
 * that call alone.
 *
 * <p>User-scoped tools receive the turn's user id under {@link AgentTool#USER_ID_ARG}, overriding
 * anything the model put there. The recorded arguments stay as the model sent them.</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AgentToolExecutor {

    private final ToolRegistry registry;
    private final AgentProperties properties;

    public Mono<ToolExecutionResult> execute(String userId, ToolCall call) {
        Optional<AgentTool> resolved = registry.lookup(call.name());
        if (resolved.isEmpty()) {
            log.warn("Model requested unknown tool name={} callId={}", call.name(), call.id());
            return Mono.just(result(call, "Unknown tool: " + call.name()));
        }
        AgentTool tool = resolved.get();
        Duration timeout = toolTimeout();

        Map<String, Object> args = new LinkedHashMap<>(call.arguments());
        if (tool.userScoped()) {
            args.put(AgentTool.USER_ID_ARG, userId);
        }

        return Mono.fromCallable(() -> tool.execute(args))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(timeout)
                .map(output -> result(call, output.content() != null ? output.content() : ""))
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.warn("Tool '{}' call id={} returned no result", tool.name(), call.id());
                    return result(call, "Tool error: empty result");
                }))
                .doOnNext(done -> log.debug("Tool '{}' call id={} produced payloadLength={}",
                        tool.name(), call.id(), done.content().length()))
                .onErrorResume(ex -> {
                    log.warn("Tool '{}' call id={} failed", tool.name(), call.id(), ex);
                    return Mono.just(result(call, "Tool error: " + describe(ex, timeout)));
                });
    }

    /**
     * Executes one round concurrently. Results come back in request order.
     */
    public Mono<List<ToolExecutionResult>> executeRound(String userId, List<ToolCall> calls) {
        log.debug("Executing {} tool call(s) userId={}", calls.size(), userId);
        return Flux.fromIterable(calls)
                .flatMapSequential(call -> execute(userId, call))
                .collectList()
                .doOnNext(results -> log.debug("Completed execution of {} tool call(s)", results.size()));
    }

    private ToolExecutionResult result(ToolCall call, String content) {
        Map<String, Object> args = call.arguments();
        return new ToolExecutionResult(call.id(), call.name(), args, content);
    }

    private Duration toolTimeout() {
        return Duration.ofMillis(Math.max(properties.getTools().getTimeoutMs(), 100));
    }

    private static String describe(Throwable ex, Duration timeout) {
        if (ex instanceof TimeoutException) {
            return "timed out after " + timeout.toMillis() + " ms";
        }
        String message = ex.getMessage();
        return message != null && !message.isBlank() ? message : ex.getClass().getSimpleName();
    }
}
