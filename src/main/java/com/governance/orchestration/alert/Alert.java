package com.governance.orchestration.alert;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 告警
 *
 * <p>同一 (type, metric) 未解决时只有一条，再次突破只更新当前值与时间。
 * 仍处于突破状态的对象全部回落后才自动解决。
 */
public class Alert {

    private final String id;
    private final String type;
    private final String metric;
    private final double threshold;
    private final Instant createdAt;
    private final List<String> recommendations;
    private final Set<String> subjects = new LinkedHashSet<>();
    private final Set<String> breachingSubjects = new LinkedHashSet<>();

    private AlertSeverity severity;
    private double currentValue;
    private String message;
    private Instant updatedAt;
    private int occurrences;
    private boolean resolved;
    private Instant resolutionTime;
    private String resolutionNote;

    Alert(String id, String type, String metric, double threshold, double currentValue, String subject) {
        this.id = id;
        this.type = type;
        this.metric = metric;
        this.threshold = threshold;
        this.createdAt = Instant.now();
        this.recommendations = AlertMetrics.recommendationsFor(metric);
        update(currentValue, subject);
    }

    synchronized void update(double value, String subject) {
        this.currentValue = value;
        this.severity = AlertSeverity.fromBreachRatio(threshold > 0 ? value / threshold : Double.MAX_VALUE);
        this.message = String.format("%s %.2f exceeds threshold %.2f", metric, value, threshold);
        this.updatedAt = Instant.now();
        this.occurrences++;
        if (subject != null) {
            subjects.add(subject);
        }
        breachingSubjects.add(subjectKey(subject));
    }

    /**
     * 记录某对象已回落到阈值以下
     *
     * @return 所有突破对象均已回落
     */
    synchronized boolean recover(String subject) {
        breachingSubjects.remove(subjectKey(subject));
        return breachingSubjects.isEmpty();
    }

    private static String subjectKey(String subject) {
        return subject == null ? "" : subject;
    }

    synchronized boolean resolve(String note) {
        if (resolved) {
            return false;
        }
        resolved = true;
        resolutionTime = Instant.now();
        resolutionNote = note;
        return true;
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public String getMetric() {
        return metric;
    }

    public double getThreshold() {
        return threshold;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public List<String> getRecommendations() {
        return recommendations;
    }

    public synchronized Set<String> getSubjects() {
        return Set.copyOf(subjects);
    }

    /**
     * 当前仍处于突破状态的对象
     */
    public synchronized Set<String> getBreachingSubjects() {
        return Set.copyOf(breachingSubjects);
    }

    public synchronized AlertSeverity getSeverity() {
        return severity;
    }

    public synchronized double getCurrentValue() {
        return currentValue;
    }

    public synchronized String getMessage() {
        return message;
    }

    public synchronized Instant getUpdatedAt() {
        return updatedAt;
    }

    public synchronized int getOccurrences() {
        return occurrences;
    }

    public synchronized boolean isResolved() {
        return resolved;
    }

    public synchronized Instant getResolutionTime() {
        return resolutionTime;
    }

    public synchronized String getResolutionNote() {
        return resolutionNote;
    }
}
