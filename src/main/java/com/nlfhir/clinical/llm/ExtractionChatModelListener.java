package com.nlfhir.clinical.llm;

import dev.langchain4j.model.chat.listener.ChatModelErrorContext;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.chat.listener.ChatModelRequestContext;
import dev.langchain4j.model.chat.listener.ChatModelResponseContext;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;

/**
 * Logs model, latency and token usage for every extraction call.
 */
@Slf4j
public class ExtractionChatModelListener implements ChatModelListener {

    static final String START_NANOS = "clinical_extraction_start_nanos";

    @Override
    public void onRequest(ChatModelRequestContext context) {
        context.attributes().put(START_NANOS, System.nanoTime());
        log.debug("Generative extraction request: model={}, messages={}",
                context.chatRequest().parameters().modelName(),
                context.chatRequest().messages().size());
    }

    @Override
    public void onResponse(ChatModelResponseContext context) {
        TokenUsage usage = context.chatResponse().tokenUsage();
        log.info("Generative extraction response: model={}, latency={}ms, inputTokens={}, outputTokens={}",
                context.chatResponse().modelName(),
                elapsedMillis(context.attributes().get(START_NANOS)),
                usage != null ? usage.inputTokenCount() : null,
                usage != null ? usage.outputTokenCount() : null);
    }

    @Override
    public void onError(ChatModelErrorContext context) {
        log.error("Generative extraction call failed after {}ms: {}",
                elapsedMillis(context.attributes().get(START_NANOS)),
                context.error().getMessage());
    }

    private static long elapsedMillis(Object startNanos) {
        if (startNanos instanceof Long start) {
            return (System.nanoTime() - start) / 1_000_000;
        }
        return -1;
    }
}
