package com.example.frontdesk.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Front desk 설정 (prefix = "frontdesk").
 *
 * <p>기본값은 단일 인스턴스 데모 환경 기준이며, 운영에서는 application.yml 에서 덮어씁니다.</p>
 */
@ConfigurationProperties(prefix = "frontdesk")
public class FrontdeskProperties {

    private final Knowledge knowledge = new Knowledge();
    private final HelpRequest helpRequest = new HelpRequest();
    private final Call call = new Call();
    private final Business business = new Business();
    private final Seed seed = new Seed();

    public Knowledge getKnowledge() {
        return knowledge;
    }

    public HelpRequest getHelpRequest() {
        return helpRequest;
    }

    public Call getCall() {
        return call;
    }

    public Business getBusiness() {
        return business;
    }

    public Seed getSeed() {
        return seed;
    }

    public static class Knowledge {

        /** Jaccard threshold for a snapshot hit (inclusive). */
        private double similarityThreshold = 0.6;

        /** how many learned entries go into the prompt context */
        private int promptLimit = 10;

        public double getSimilarityThreshold() {
            return similarityThreshold;
        }

        public void setSimilarityThreshold(double similarityThreshold) {
            this.similarityThreshold = similarityThreshold;
        }

        public int getPromptLimit() {
            return promptLimit;
        }

        public void setPromptLimit(int promptLimit) {
            this.promptLimit = promptLimit;
        }
    }

    public static class HelpRequest {

        /** PENDING 요청이 이 시간(h)을 넘기면 TIMEOUT 처리 */
        private long timeoutHours = 24;

        /** stats() 집계 대상 최근 요청 수 */
        private int statsWindow = 1000;

        /** number of turns copied into the request context */
        private int contextTurns = 5;

        private String defaultResolverName = "Supervisor";

        public long getTimeoutHours() {
            return timeoutHours;
        }

        public void setTimeoutHours(long timeoutHours) {
            this.timeoutHours = timeoutHours;
        }

        public int getStatsWindow() {
            return statsWindow;
        }

        public void setStatsWindow(int statsWindow) {
            this.statsWindow = statsWindow;
        }

        public int getContextTurns() {
            return contextTurns;
        }

        public void setContextTurns(int contextTurns) {
            this.contextTurns = contextTurns;
        }

        public String getDefaultResolverName() {
            return defaultResolverName;
        }

        public void setDefaultResolverName(String defaultResolverName) {
            this.defaultResolverName = defaultResolverName;
        }
    }

    public static class Call {

        /** wall-clock cap per call session */
        private Duration maxDuration = Duration.ofHours(1);

        /** turns sent to the generator */
        private int historyTurns = 10;

        /** how long the text API waits for a reply to one utterance */
        private Duration replyTimeout = Duration.ofSeconds(30);

        public Duration getMaxDuration() {
            return maxDuration;
        }

        public void setMaxDuration(Duration maxDuration) {
            this.maxDuration = maxDuration;
        }

        public int getHistoryTurns() {
            return historyTurns;
        }

        public void setHistoryTurns(int historyTurns) {
            this.historyTurns = historyTurns;
        }

        public Duration getReplyTimeout() {
            return replyTimeout;
        }

        public void setReplyTimeout(Duration replyTimeout) {
            this.replyTimeout = replyTimeout;
        }
    }

    public static class Business {

        private String name = "Luxe Hair Salon";
        private String hours = "Monday-Saturday 9AM-7PM, Closed Sundays";
        private String phone = "+1-555-123-4567";
        private String services = "Haircuts, Coloring, Styling, Extensions, Treatments";
        private String pricing = "Haircuts from $45, Coloring from $80, Styling from $35";
        private String location = "123 Main Street, Downtown";

        /** link printed in supervisor alerts */
        private String dashboardUrl = "http://localhost:8080/api/requests/pending";

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getHours() {
            return hours;
        }

        public void setHours(String hours) {
            this.hours = hours;
        }

        public String getPhone() {
            return phone;
        }

        public void setPhone(String phone) {
            this.phone = phone;
        }

        public String getServices() {
            return services;
        }

        public void setServices(String services) {
            this.services = services;
        }

        public String getPricing() {
            return pricing;
        }

        public void setPricing(String pricing) {
            this.pricing = pricing;
        }

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }

        public String getDashboardUrl() {
            return dashboardUrl;
        }

        public void setDashboardUrl(String dashboardUrl) {
            this.dashboardUrl = dashboardUrl;
        }
    }

    public static class Seed {

        private boolean enabled = false;

        /** also insert one PENDING sample request so the dashboard is not empty */
        private boolean sampleRequest = false;

        private List<Entry> entries = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isSampleRequest() {
            return sampleRequest;
        }

        public void setSampleRequest(boolean sampleRequest) {
            this.sampleRequest = sampleRequest;
        }

        public List<Entry> getEntries() {
            return entries;
        }

        public void setEntries(List<Entry> entries) {
            this.entries = entries;
        }

        public static class Entry {
            private String question;
            private String answer;

            public String getQuestion() {
                return question;
            }

            public void setQuestion(String question) {
                this.question = question;
            }

            public String getAnswer() {
                return answer;
            }

            public void setAnswer(String answer) {
                this.answer = answer;
            }
        }
    }
}
