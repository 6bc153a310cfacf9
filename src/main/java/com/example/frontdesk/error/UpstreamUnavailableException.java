package com.example.frontdesk.error;

/**
 * Store, oracle or notification channel unreachable or answering garbage.
 */
public class UpstreamUnavailableException extends FrontdeskException {

    private final String upstream;

    public UpstreamUnavailableException(String upstream, String message) {
        super(upstream + ": " + message);
        this.upstream = upstream;
    }

    public UpstreamUnavailableException(String upstream, String message, Throwable cause) {
        super(upstream + ": " + message, cause);
        this.upstream = upstream;
    }

    public String upstream() {
        return upstream;
    }

    @Override
    public String code() {
        return "upstream_unavailable";
    }
}
