package com.physio.search.ranking;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.ranking")
public class RankingWeightsProperties {
    private double exactPhrase = 100.0;
    private double nameToken = 50.0;
    private double categoryToken = 30.0;
    private double descriptionToken = 20.0;
    private double goalsToken = 15.0;
    private double confidenceFactor = 0.1;
    private int recencyWindowDays = 30;
    private double recencyMaxBonus = 10.0;
    private double recencyDecayPerDay = 0.3;

    public double getExactPhrase() {
        return exactPhrase;
    }

    public void setExactPhrase(double exactPhrase) {
        this.exactPhrase = exactPhrase;
    }

    public double getNameToken() {
        return nameToken;
    }

    public void setNameToken(double nameToken) {
        this.nameToken = nameToken;
    }

    public double getCategoryToken() {
        return categoryToken;
    }

    public void setCategoryToken(double categoryToken) {
        this.categoryToken = categoryToken;
    }

    public double getDescriptionToken() {
        return descriptionToken;
    }

    public void setDescriptionToken(double descriptionToken) {
        this.descriptionToken = descriptionToken;
    }

    public double getGoalsToken() {
        return goalsToken;
    }

    public void setGoalsToken(double goalsToken) {
        this.goalsToken = goalsToken;
    }

    public double getConfidenceFactor() {
        return confidenceFactor;
    }

    public void setConfidenceFactor(double confidenceFactor) {
        this.confidenceFactor = confidenceFactor;
    }

    public int getRecencyWindowDays() {
        return recencyWindowDays;
    }

    public void setRecencyWindowDays(int recencyWindowDays) {
        this.recencyWindowDays = recencyWindowDays;
    }

    public double getRecencyMaxBonus() {
        return recencyMaxBonus;
    }

    public void setRecencyMaxBonus(double recencyMaxBonus) {
        this.recencyMaxBonus = recencyMaxBonus;
    }

    public double getRecencyDecayPerDay() {
        return recencyDecayPerDay;
    }

    public void setRecencyDecayPerDay(double recencyDecayPerDay) {
        this.recencyDecayPerDay = recencyDecayPerDay;
    }
}
