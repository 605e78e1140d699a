package com.eainde.compliance.config;

import dev.langchain4j.model.chat.listener.ChatModelErrorContext;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.chat.listener.ChatModelRequestContext;
import dev.langchain4j.model.chat.listener.ChatModelResponseContext;
import dev.langchain4j.model.output.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs duration and token usage of every completion call. Runs on the calling
 * thread, so the jurisdiction MDC key is present in its log lines.
 */
public class ComplianceTelemetryListener implements ChatModelListener {

    private static final Logger log = LoggerFactory.getLogger(ComplianceTelemetryListener.class);

    static final String START_TIME = "compliance.startTime";

    @Override
    public void onRequest(ChatModelRequestContext requestContext) {
        log.debug("Sending {} messages to completion service", requestContext.chatRequest().messages().size());
        requestContext.attributes().put(START_TIME, System.currentTimeMillis());
    }

    @Override
    public void onResponse(ChatModelResponseContext responseContext) {
        Object startTime = responseContext.attributes().get(START_TIME);
        long duration = startTime instanceof Long ? System.currentTimeMillis() - (Long) startTime : -1L;

        TokenUsage usage = responseContext.chatResponse().tokenUsage();
        if (usage == null) {
            log.info("Completion responded in {}ms (no token usage reported)", duration);
            return;
        }
        log.info("Completion responded in {}ms, tokens in={} out={} total={}",
                duration, usage.inputTokenCount(), usage.outputTokenCount(), usage.totalTokenCount());
    }

    @Override
    public void onError(ChatModelErrorContext errorContext) {
        log.warn("Completion call failed: {}", errorContext.error().toString());
    }
}
