package com.example.frontdesk.knowledge;

import com.example.frontdesk.config.FrontdeskProperties;
import com.example.frontdesk.domain.HelpRequest;
import com.example.frontdesk.domain.enums.RequestStatus;
import com.example.frontdesk.store.FrontdeskStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 애플리케이션 시작 시 초기 지식(seed)을 적재합니다. 저장소에 지식이 하나라도 있으면 건너뜁니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "frontdesk.seed.enabled", havingValue = "true")
public class KnowledgeSeeder implements CommandLineRunner {

    private final FrontdeskProperties props;
    private final FrontdeskStore store;
    private final KnowledgeIndex knowledgeIndex;
    private final Clock clock;

    @Override
    public void run(String... args) {
        if (store.countKnowledge() > 0) {
            log.info("[SEED] knowledge store not empty, skipping");
            return;
        }
        int added = 0;
        for (FrontdeskProperties.Seed.Entry e : props.getSeed().getEntries()) {
            if (e.getQuestion() == null || e.getQuestion().isBlank()
                    || e.getAnswer() == null || e.getAnswer().isBlank()) {
                log.warn("[SEED] skipping incomplete entry question=\"{}\"", e.getQuestion());
                continue;
            }
            knowledgeIndex.seed(e.getQuestion(), e.getAnswer());
            added++;
        }

        if (props.getSeed().isSampleRequest()) {
            Long id = store.createHelpRequest(HelpRequest.builder()
                    .callerId("test_caller_1")
                    .callerContact("+1-555-999-0001")
                    .question("Do you offer senior discounts?")
                    .context("Caller asking about pricing for elderly customers")
                    .status(RequestStatus.PENDING)
                    .createdAt(LocalDateTime.now(clock))
                    .build());
            log.info("[SEED] sample help request id={}", id);
        }
        log.info("[SEED] {} knowledge entr{} added", added, added == 1 ? "y" : "ies");
    }
}
