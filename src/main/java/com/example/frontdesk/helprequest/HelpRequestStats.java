package com.example.frontdesk.helprequest;

/**
 * Aggregate over the most recent help requests.
 *
 * @param avgResolutionMinutes mean created→resolved time of RESOLVED requests, one decimal; 0 if none
 * @param resolutionRatePct    resolved / total * 100, one decimal; 0 if total is 0
 */
public record HelpRequestStats(
        int total,
        int pending,
        int resolved,
        int timeout,
        double avgResolutionMinutes,
        double resolutionRatePct
) {
    public static final HelpRequestStats EMPTY = new HelpRequestStats(0, 0, 0, 0, 0.0, 0.0);
}
