package com.example.frontdesk.domain.enums;

/**
 * How a knowledge entry got into the store.
 */
public enum KnowledgeSource {
    SUPERVISOR, // learned from a resolved help request
    SEED        // bulk-loaded at startup
}
