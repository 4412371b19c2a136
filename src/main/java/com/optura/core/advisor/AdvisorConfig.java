package com.optura.core.advisor;

import com.optura.core.llm.LlmProperties;
import com.optura.core.llm.LlmService;
import com.optura.core.metrics.OpturaMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chooses the advisor variant: model-backed when an API key and a chat client
 * are available, deterministic otherwise.
 */
@Configuration
public class AdvisorConfig {

    private static final Logger log = LoggerFactory.getLogger(AdvisorConfig.class);

    @Bean
    public TaskAdvisor taskAdvisor(LlmProperties properties,
                                   ObjectProvider<ChatClient.Builder> chatClientBuilder,
                                   OpturaMetrics metrics,
                                   @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        var fallback = new FallbackTaskAdvisor();
        ChatClient.Builder builder = chatClientBuilder.getIfAvailable();
        if (!properties.hasOpenaiKey() || builder == null) {
            log.warn("No LLM configured (api key present: {}), using deterministic task advisor",
                    properties.hasOpenaiKey());
            return fallback;
        }
        log.info("Using model-backed task advisor (provider={}, model={})",
                properties.getProvider(), properties.getModel());
        return new LlmTaskAdvisor(new LlmService(builder, baseUrl), fallback, metrics);
    }
}
