package com.example.frontdesk.oracle;

import com.example.frontdesk.domain.Turn;

import java.util.List;

/**
 * LLM boundary: a yes/no "can I answer this?" judgment and free-text reply generation.
 *
 * <p>Both operations report transport errors and unusable output as
 * {@link com.example.frontdesk.error.UpstreamUnavailableException}.</p>
 */
public interface EscalationOracle {

    Verdict classify(String systemContext, String question);

    String generate(String systemContext, List<Turn> history);
}
