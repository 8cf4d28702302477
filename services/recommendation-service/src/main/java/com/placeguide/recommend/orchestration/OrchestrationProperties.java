package com.placeguide.recommend.orchestration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "recommend.orchestration")
public class OrchestrationProperties {
    private int defaultTimeoutMs = 3000;
    private int minTimeoutMs = 100;
    private int maxTimeoutMs = 10000;
    private double retrievalShare = 0.7;
    private double scoringShare = 0.15;
    private double selectionShare = 0.15;
    private int minStageMs = 20;
    private int profileWaitMs = 300;
    private String clarifyingQuestion =
        "Подскажи, какой отдых тебе интересен? Например: уютное кафе, музей, парк для прогулки "
            + "или бар с живой музыкой. Можно указать район или место, рядом с которым искать.";
    private String unavailableMessage = "Поиск сейчас недоступен, попробуй ещё раз чуть позже.";
    private String noMatchesMessage = "Ничего подходящего не нашлось. Попробуй расширить запрос или район поиска.";

    public int getDefaultTimeoutMs() {
        return defaultTimeoutMs;
    }

    public void setDefaultTimeoutMs(int defaultTimeoutMs) {
        this.defaultTimeoutMs = defaultTimeoutMs;
    }

    public int getMinTimeoutMs() {
        return minTimeoutMs;
    }

    public void setMinTimeoutMs(int minTimeoutMs) {
        this.minTimeoutMs = minTimeoutMs;
    }

    public int getMaxTimeoutMs() {
        return maxTimeoutMs;
    }

    public void setMaxTimeoutMs(int maxTimeoutMs) {
        this.maxTimeoutMs = maxTimeoutMs;
    }

    public double getRetrievalShare() {
        return retrievalShare;
    }

    public void setRetrievalShare(double retrievalShare) {
        this.retrievalShare = retrievalShare;
    }

    public double getScoringShare() {
        return scoringShare;
    }

    public void setScoringShare(double scoringShare) {
        this.scoringShare = scoringShare;
    }

    public double getSelectionShare() {
        return selectionShare;
    }

    public void setSelectionShare(double selectionShare) {
        this.selectionShare = selectionShare;
    }

    public int getMinStageMs() {
        return minStageMs;
    }

    public void setMinStageMs(int minStageMs) {
        this.minStageMs = minStageMs;
    }

    public int getProfileWaitMs() {
        return profileWaitMs;
    }

    public void setProfileWaitMs(int profileWaitMs) {
        this.profileWaitMs = profileWaitMs;
    }

    public String getClarifyingQuestion() {
        return clarifyingQuestion;
    }

    public void setClarifyingQuestion(String clarifyingQuestion) {
        this.clarifyingQuestion = clarifyingQuestion;
    }

    public String getUnavailableMessage() {
        return unavailableMessage;
    }

    public void setUnavailableMessage(String unavailableMessage) {
        this.unavailableMessage = unavailableMessage;
    }

    public String getNoMatchesMessage() {
        return noMatchesMessage;
    }

    public void setNoMatchesMessage(String noMatchesMessage) {
        this.noMatchesMessage = noMatchesMessage;
    }
}
