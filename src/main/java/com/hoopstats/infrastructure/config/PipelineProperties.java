package com.hoopstats.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed view of the {@code pipeline.*} configuration.
 */
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    private List<Source> sources = new ArrayList<>();
    private Validation validation = new Validation();
    private Reconciliation reconciliation = new Reconciliation();
    private Run run = new Run();
    private Health health = new Health();
    private Schedule schedule = new Schedule();
    private Http http = new Http();

    public List<Source> getSources() {
        return sources;
    }

    public void setSources(List<Source> sources) {
        this.sources = sources;
    }

    public Validation getValidation() {
        return validation;
    }

    public void setValidation(Validation validation) {
        this.validation = validation;
    }

    public Reconciliation getReconciliation() {
        return reconciliation;
    }

    public void setReconciliation(Reconciliation reconciliation) {
        this.reconciliation = reconciliation;
    }

    public Run getRun() {
        return run;
    }

    public void setRun(Run run) {
        this.run = run;
    }

    public Health getHealth() {
        return health;
    }

    public void setHealth(Health health) {
        this.health = health;
    }

    public Schedule getSchedule() {
        return schedule;
    }

    public void setSchedule(Schedule schedule) {
        this.schedule = schedule;
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    /**
     * One configured source. {@code type} selects the adapter implementation.
     */
    public static class Source {

        private String id;
        private String type;
        /** Lower wins; 1 is the most trusted source. */
        private int precedence = 1;
        /** 0 disables the per-minute cap. */
        private int maxRequestsPerMinute;
        private Duration minDelay = Duration.ZERO;
        private String baseUrl;
        private String location;
        private boolean enabled = true;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public int getPrecedence() {
            return precedence;
        }

        public void setPrecedence(int precedence) {
            this.precedence = precedence;
        }

        public int getMaxRequestsPerMinute() {
            return maxRequestsPerMinute;
        }

        public void setMaxRequestsPerMinute(int maxRequestsPerMinute) {
            this.maxRequestsPerMinute = maxRequestsPerMinute;
        }

        public Duration getMinDelay() {
            return minDelay;
        }

        public void setMinDelay(Duration minDelay) {
            this.minDelay = minDelay;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class Rule {

        private boolean required;
        private String type = "numeric";
        private Double min;
        private Double max;
        private List<String> domain = new ArrayList<>();

        public boolean isRequired() {
            return required;
        }

        public void setRequired(boolean required) {
            this.required = required;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public Double getMin() {
            return min;
        }

        public void setMin(Double min) {
            this.min = min;
        }

        public Double getMax() {
            return max;
        }

        public void setMax(Double max) {
            this.max = max;
        }

        public List<String> getDomain() {
            return domain;
        }

        public void setDomain(List<String> domain) {
            this.domain = domain;
        }
    }

    public static class Validation {

        /** Overrides of the built-in per-game rules, by field name. */
        private Map<String, Rule> rules = new LinkedHashMap<>();
        private double maxInvalidRequiredFraction = 0.5;

        public Map<String, Rule> getRules() {
            return rules;
        }

        public void setRules(Map<String, Rule> rules) {
            this.rules = rules;
        }

        public double getMaxInvalidRequiredFraction() {
            return maxInvalidRequiredFraction;
        }

        public void setMaxInvalidRequiredFraction(double maxInvalidRequiredFraction) {
            this.maxInvalidRequiredFraction = maxInvalidRequiredFraction;
        }
    }

    public static class Reconciliation {

        private Map<String, Double> tolerance = new LinkedHashMap<>();
        private double defaultTolerance = 0.1;

        public Map<String, Double> getTolerance() {
            return tolerance;
        }

        public void setTolerance(Map<String, Double> tolerance) {
            this.tolerance = tolerance;
        }

        public double getDefaultTolerance() {
            return defaultTolerance;
        }

        public void setDefaultTolerance(double defaultTolerance) {
            this.defaultTolerance = defaultTolerance;
        }
    }

    public static class Run {

        private Duration timeout = Duration.ofMinutes(30);
        private int maxRetries = 3;
        private Backoff backoff = new Backoff();

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Backoff getBackoff() {
            return backoff;
        }

        public void setBackoff(Backoff backoff) {
            this.backoff = backoff;
        }
    }

    public static class Backoff {

        private Duration base = Duration.ofSeconds(5);
        private double factor = 2.0;
        private Duration cap = Duration.ofSeconds(60);

        public Duration getBase() {
            return base;
        }

        public void setBase(Duration base) {
            this.base = base;
        }

        public double getFactor() {
            return factor;
        }

        public void setFactor(double factor) {
            this.factor = factor;
        }

        public Duration getCap() {
            return cap;
        }

        public void setCap(Duration cap) {
            this.cap = cap;
        }
    }

    public static class Health {

        private int window = 10;
        private int minSamples = 5;
        private double threshold = 0.3;
        private Duration cooldown = Duration.ofMinutes(10);

        public int getWindow() {
            return window;
        }

        public void setWindow(int window) {
            this.window = window;
        }

        public int getMinSamples() {
            return minSamples;
        }

        public void setMinSamples(int minSamples) {
            this.minSamples = minSamples;
        }

        public double getThreshold() {
            return threshold;
        }

        public void setThreshold(double threshold) {
            this.threshold = threshold;
        }

        public Duration getCooldown() {
            return cooldown;
        }

        public void setCooldown(Duration cooldown) {
            this.cooldown = cooldown;
        }
    }

    public static class Schedule {

        /** Spring cron expression; "-" disables scheduled runs. */
        private String cron = "-";
        private List<Integer> seasons = new ArrayList<>();

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }

        public List<Integer> getSeasons() {
            return seasons;
        }

        public void setSeasons(List<Integer> seasons) {
            this.seasons = seasons;
        }
    }

    public static class Http {

        private Duration timeout = Duration.ofSeconds(30);

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }
}
