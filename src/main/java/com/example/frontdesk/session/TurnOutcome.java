package com.example.frontdesk.session;

/**
 * What happened to one caller utterance, plus the reply the agent should speak.
 */
public record TurnOutcome(Kind kind, String reply, Long knowledgeEntryId, Long helpRequestId) {

    public enum Kind {
        /** answered from learned knowledge, oracle not consulted */
        KNOWLEDGE_HIT,
        /** oracle judged it answerable; reply generated */
        ANSWERED,
        /** handed to the supervisor; reply is the call-back promise */
        ESCALATED,
        /** no usable reply: empty utterance, escalation not persisted, or generation failed */
        FAILED
    }

    public static TurnOutcome knowledgeHit(String answer, Long entryId) {
        return new TurnOutcome(Kind.KNOWLEDGE_HIT, answer, entryId, null);
    }

    public static TurnOutcome answered(String reply) {
        return new TurnOutcome(Kind.ANSWERED, reply, null, null);
    }

    public static TurnOutcome escalated(String promise, Long helpRequestId) {
        return new TurnOutcome(Kind.ESCALATED, promise, null, helpRequestId);
    }

    public static TurnOutcome failed(String apology) {
        return new TurnOutcome(Kind.FAILED, apology, null, null);
    }
}
