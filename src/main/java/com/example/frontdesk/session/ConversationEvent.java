package com.example.frontdesk.session;

import java.util.concurrent.CompletableFuture;

/**
 * Typed event on a call's inbound stream. Consumed in order by exactly one {@link ConversationSession}.
 *
 * @param replyTo completed with the turn's outcome for {@link Type#CALLER_UTTERANCE}; may be null
 */
public record ConversationEvent(Type type, String text, CompletableFuture<TurnOutcome> replyTo) {

    public enum Type {
        /** the caller said something (speech-to-text committed) */
        CALLER_UTTERANCE,
        /** the agent runtime spoke on its own (greeting, filler) */
        AGENT_REPLY,
        END_OF_CALL
    }

    public static ConversationEvent utterance(String text) {
        return new ConversationEvent(Type.CALLER_UTTERANCE, text, null);
    }

    public static ConversationEvent utterance(String text, CompletableFuture<TurnOutcome> replyTo) {
        return new ConversationEvent(Type.CALLER_UTTERANCE, text, replyTo);
    }

    public static ConversationEvent agentReply(String text) {
        return new ConversationEvent(Type.AGENT_REPLY, text, null);
    }

    public static ConversationEvent endOfCall() {
        return new ConversationEvent(Type.END_OF_CALL, null, null);
    }
}
