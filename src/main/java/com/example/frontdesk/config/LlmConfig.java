package com.example.frontdesk.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Duration;

/**
 * LangChain4j 1.0.1 ChatModel 빈 구성.
 * - chatModel: @Primary, 응답 생성용
 * - classifyModel: @Qualifier("classifyModel"), YES/NO 판정용 (낮은 temperature, 짧은 출력)
 *
 * baseUrl 기본값은 Groq OpenAI-compatible 엔드포인트입니다.
 */
@Configuration
public class LlmConfig {

    @Bean
    @Primary
    public ChatModel chatModel(
            @Value("${llm.base-url:https://api.groq.com/openai/v1}") String baseUrl,
            @Value("${llm.api-key:${GROQ_API_KEY:}}") String apiKey,
            @Value("${llm.chat-model:llama-3.3-70b-versatile}") String model,
            @Value("${llm.chat.temperature:0.7}") double temperature,
            @Value("${llm.chat.max-tokens:150}") int maxTokens,
            @Value("${llm.timeout-seconds:20}") long timeoutSeconds
    ) {
        return OpenAiChatModel.builder()
                .baseUrl(baseUrl)
                .apiKey(apiKey)
                .modelName(model)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .build();
    }

    @Bean
    @Qualifier("classifyModel")
    public ChatModel classifyModel(
            @Value("${llm.base-url:https://api.groq.com/openai/v1}") String baseUrl,
            @Value("${llm.api-key:${GROQ_API_KEY:}}") String apiKey,
            // 별도 설정 없으면 응답 모델을 재사용
            @Value("${llm.classify-model:${llm.chat-model:llama-3.3-70b-versatile}}") String model,
            @Value("${llm.timeout-seconds:20}") long timeoutSeconds
    ) {
        return OpenAiChatModel.builder()
                .baseUrl(baseUrl)
                .apiKey(apiKey)
                .modelName(model)
                .temperature(0.1)
                .maxTokens(10)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .build();
    }
}
