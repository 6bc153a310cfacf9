package com.example.frontdesk.prompt;

import com.example.frontdesk.config.FrontdeskProperties;
import org.springframework.stereotype.Component;

/**
 * Text templates: the receptionist system prompt, the YES/NO escalation check, and the two
 * notification bodies (supervisor alert, caller follow-up).
 */
@Component
public class FrontdeskPromptBuilder {

    private static final String SYSTEM_TEMPLATE = """
            You are a professional AI receptionist for %1$s.

            BUSINESS INFORMATION:
            - Name: %1$s
            - Hours: %2$s
            - Phone: %3$s
            - Services: %4$s
            - Pricing: %5$s
            - Location: %6$s

            %7$s

            YOUR ROLE:
            You are a friendly, professional receptionist. Answer questions about services, pricing,
            hours and location. You cannot book appointments yourself.

            CRITICAL INSTRUCTIONS:
            - Be warm, professional and concise; keep responses under 3 sentences when possible.
            - If you know the answer from the business information or learned knowledge above, answer confidently.
            - If you DON'T know something, do not make it up or guess.
            - Never hallucinate information.
            """;

    private static final String ESCALATION_CHECK_TEMPLATE = """
            Based on the business information and learned knowledge provided in your system context, \
            can you confidently answer this customer question?

            Question: "%s"

            Answer with ONLY one word:
            - "YES" if you can answer this confidently with the information you have
            - "NO" if you need supervisor help because you don't have enough information

            One word answer:""";

    private static final String SUPERVISOR_ALERT_TEMPLATE = """
            New Help Request #%s

            Question: %s

            Caller: %s

            The AI needs your help to answer this question. Please respond through the supervisor dashboard: %s""";

    private static final String CALLER_FOLLOW_UP_TEMPLATE = """
            Hi! Thanks for your patience. Here's the answer to your question:

            Question: %s

            Answer: %s

            Is there anything else I can help you with? Feel free to call us back at any time!""";

    static final String ESCALATION_PROMISE = "That's a great question! Let me check with my manager to get you "
            + "the most accurate information. I'll text you the answer within a few minutes. "
            + "Is there anything else I can help you with right now?";

    static final String APOLOGY = "I apologize, I'm having trouble right now. Could you please try again?";

    private final FrontdeskProperties.Business business;

    public FrontdeskPromptBuilder(FrontdeskProperties props) {
        this.business = props.getBusiness();
    }

    /** Business facts followed by the learned-knowledge block. */
    public String systemPrompt(String knowledgeContext) {
        return String.format(SYSTEM_TEMPLATE,
                business.getName(),
                business.getHours(),
                business.getPhone(),
                business.getServices(),
                business.getPricing(),
                business.getLocation(),
                knowledgeContext == null ? "" : knowledgeContext.strip());
    }

    public String escalationCheck(String question) {
        return String.format(ESCALATION_CHECK_TEMPLATE, question);
    }

    public String supervisorAlert(String question, String callerContact, Long requestId) {
        return String.format(SUPERVISOR_ALERT_TEMPLATE, requestId, question, callerContact, business.getDashboardUrl());
    }

    public String callerFollowUp(String question, String answer) {
        return String.format(CALLER_FOLLOW_UP_TEMPLATE, question, answer);
    }

    public String escalationPromise() {
        return ESCALATION_PROMISE;
    }

    public String apology() {
        return APOLOGY;
    }
}
