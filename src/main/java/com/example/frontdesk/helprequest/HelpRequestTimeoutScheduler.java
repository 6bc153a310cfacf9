package com.example.frontdesk.helprequest;

import com.example.frontdesk.config.FrontdeskProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 오래된 PENDING 요청을 주기적으로 TIMEOUT 처리합니다.
 *
 * <p>다중 인스턴스에서 동시에 돌아도 안전합니다: 전이는 조건부 UPDATE 라서 요청 하나는 한 번만 바뀝니다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "frontdesk.help-request.sweep-enabled", havingValue = "true", matchIfMissing = true)
public class HelpRequestTimeoutScheduler {

    private final HelpRequestLifecycle lifecycle;
    private final FrontdeskProperties props;

    @Scheduled(fixedDelayString = "${frontdesk.help-request.sweep-interval-ms:900000}",
            initialDelayString = "${frontdesk.help-request.sweep-initial-delay-ms:60000}")
    public void sweep() {
        try {
            int n = lifecycle.timeoutStale(props.getHelpRequest().getTimeoutHours());
            if (n > 0) {
                log.info("[TIMEOUT_SWEEP] {} request(s) timed out", n);
            }
        } catch (RuntimeException e) {
            log.warn("[TIMEOUT_SWEEP] failed: {}", e.toString());
        }
    }
}
