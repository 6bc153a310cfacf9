package com.example.frontdesk.prompt;

import com.example.frontdesk.config.FrontdeskProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

public class FrontdeskPromptBuilderTest {

    private final FrontdeskPromptBuilder prompts = new FrontdeskPromptBuilder(new FrontdeskProperties());

    @Test
    void systemPrompt_embedsBusinessFactsAndKnowledge() {
        String p = prompts.systemPrompt("Learned Knowledge:\nQ: x\nA: y\n");
        assertThat(p).contains("Luxe Hair Salon").contains("123 Main Street").contains("Q: x");
    }

    @Test
    void supervisorAlert_linksToDashboard() {
        String alert = prompts.supervisorAlert("Do you do weddings?", "+15550001", 42L);
        assertThat(alert).contains("42").contains("Do you do weddings?").contains("+15550001")
                .contains("/api/requests/pending");
    }

    @Test
    void callerFollowUp_quotesQuestionAndAnswer() {
        assertThat(prompts.callerFollowUp("Do you do weddings?", "Yes we do."))
                .contains("Do you do weddings?").contains("Yes we do.");
    }

    @Test
    void fixedPhrases() {
        assertThat(prompts.escalationPromise()).isEqualTo(FrontdeskPromptBuilder.ESCALATION_PROMISE);
        assertThat(prompts.apology()).isEqualTo(FrontdeskPromptBuilder.APOLOGY);
        assertThat(prompts.escalationCheck("Q?")).contains("Q?");
    }
}
