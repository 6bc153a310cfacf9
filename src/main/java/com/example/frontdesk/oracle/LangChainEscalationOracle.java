package com.example.frontdesk.oracle;

import com.example.frontdesk.domain.Turn;
import com.example.frontdesk.error.UpstreamUnavailableException;
import com.example.frontdesk.prompt.FrontdeskPromptBuilder;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link EscalationOracle} on LangChain4j {@link ChatModel}s (OpenAI-compatible, Groq by default).
 */
@Slf4j
@Component
public class LangChainEscalationOracle implements EscalationOracle {

    private static final String UPSTREAM = "oracle";

    private final ChatModel classifyModel;
    private final ChatModel chatModel;
    private final FrontdeskPromptBuilder prompts;

    public LangChainEscalationOracle(@Qualifier("classifyModel") ChatModel classifyModel,
                                     ChatModel chatModel,
                                     FrontdeskPromptBuilder prompts) {
        this.classifyModel = classifyModel;
        this.chatModel = chatModel;
        this.prompts = prompts;
    }

    @Override
    public Verdict classify(String systemContext, String question) {
        String reply = call(classifyModel, List.of(
                SystemMessage.from(systemContext),
                UserMessage.from(prompts.escalationCheck(question))));
        Verdict verdict = Verdict.parse(reply);
        log.debug("[ORACLE] verdict={} raw=\"{}\"", verdict, reply);
        return verdict;
    }

    @Override
    public String generate(String systemContext, List<Turn> history) {
        List<ChatMessage> messages = new ArrayList<>(history.size() + 1);
        messages.add(SystemMessage.from(systemContext));
        for (Turn t : history) {
            if (t.text().isBlank()) continue;
            messages.add(t.isUser() ? UserMessage.from(t.text()) : AiMessage.from(t.text()));
        }
        String reply = call(chatModel, messages);
        if (reply == null || reply.isBlank()) {
            throw new UpstreamUnavailableException(UPSTREAM, "empty generation");
        }
        return reply.strip();
    }

    private static String call(ChatModel model, List<ChatMessage> messages) {
        try {
            return model.chat(messages).aiMessage().text();
        } catch (RuntimeException e) {
            throw new UpstreamUnavailableException(UPSTREAM, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }
}
