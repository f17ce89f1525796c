package dev.brainlift.pipeline;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised weights for source scoring and filtering.
 *
 * <p>Properties are bound from {@code brainlift.research.scoring.*}.
 *
 * <ul>
 *   <li>Credibility: {@code base-credibility} plus {@code academic-boost} or {@code industry-boost}
 *       by source type, {@code recency-boost} when published within {@code recency-window-years},
 *       {@code long-content-boost} above {@code long-content-threshold} characters, and {@code
 *       high-native-score-boost} / {@code medium-native-score-boost} above the matching native
 *       score thresholds.
 *   <li>Relevance: {@code base-relevance} plus {@code title-match-weight} per purpose keyword in
 *       the title, {@code content-match-weight} per keyword in the content and {@code
 *       native-score-weight} times the native score.
 *   <li>Filtering: results below {@code min-content-length}, {@code min-title-length} or {@code
 *       min-native-score} are discarded.
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}.
 */
@Configuration
@ConfigurationProperties(prefix = "brainlift.research.scoring")
public class ScoringProperties {

  private double baseCredibility = 5;
  private double academicBoost = 3;
  private double industryBoost = 2;
  private double recencyBoost = 1;
  private int recencyWindowYears = 3;
  private double longContentBoost = 1;
  private int longContentThreshold = 1000;
  private double highNativeScoreBoost = 2;
  private double highNativeScoreThreshold = 0.8;
  private double mediumNativeScoreBoost = 1;
  private double mediumNativeScoreThreshold = 0.6;

  private double baseRelevance = 5;
  private double titleMatchWeight = 2;
  private double contentMatchWeight = 0.5;
  private double nativeScoreWeight = 3;

  private int minContentLength = 100;
  private int minTitleLength = 10;
  private double minNativeScore = 0.3;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (recencyWindowYears < 0) {
      throw new IllegalStateException(
          "brainlift.research.scoring.recency-window-years must be >= 0, got: "
              + recencyWindowYears);
    }
    if (mediumNativeScoreThreshold > highNativeScoreThreshold) {
      throw new IllegalStateException(
          "brainlift.research.scoring.medium-native-score-threshold must not exceed"
              + " high-native-score-threshold");
    }
    if (minNativeScore < 0.0 || minNativeScore > 1.0) {
      throw new IllegalStateException(
          "brainlift.research.scoring.min-native-score must be in [0.0, 1.0], got: "
              + minNativeScore);
    }
  }

  public double getBaseCredibility() {
    return baseCredibility;
  }

  public void setBaseCredibility(double baseCredibility) {
    this.baseCredibility = baseCredibility;
  }

  public double getAcademicBoost() {
    return academicBoost;
  }

  public void setAcademicBoost(double academicBoost) {
    this.academicBoost = academicBoost;
  }

  public double getIndustryBoost() {
    return industryBoost;
  }

  public void setIndustryBoost(double industryBoost) {
    this.industryBoost = industryBoost;
  }

  public double getRecencyBoost() {
    return recencyBoost;
  }

  public void setRecencyBoost(double recencyBoost) {
    this.recencyBoost = recencyBoost;
  }

  public int getRecencyWindowYears() {
    return recencyWindowYears;
  }

  public void setRecencyWindowYears(int recencyWindowYears) {
    this.recencyWindowYears = recencyWindowYears;
  }

  public double getLongContentBoost() {
    return longContentBoost;
  }

  public void setLongContentBoost(double longContentBoost) {
    this.longContentBoost = longContentBoost;
  }

  public int getLongContentThreshold() {
    return longContentThreshold;
  }

  public void setLongContentThreshold(int longContentThreshold) {
    this.longContentThreshold = longContentThreshold;
  }

  public double getHighNativeScoreBoost() {
    return highNativeScoreBoost;
  }

  public void setHighNativeScoreBoost(double highNativeScoreBoost) {
    this.highNativeScoreBoost = highNativeScoreBoost;
  }

  public double getHighNativeScoreThreshold() {
    return highNativeScoreThreshold;
  }

  public void setHighNativeScoreThreshold(double highNativeScoreThreshold) {
    this.highNativeScoreThreshold = highNativeScoreThreshold;
  }

  public double getMediumNativeScoreBoost() {
    return mediumNativeScoreBoost;
  }

  public void setMediumNativeScoreBoost(double mediumNativeScoreBoost) {
    this.mediumNativeScoreBoost = mediumNativeScoreBoost;
  }

  public double getMediumNativeScoreThreshold() {
    return mediumNativeScoreThreshold;
  }

  public void setMediumNativeScoreThreshold(double mediumNativeScoreThreshold) {
    this.mediumNativeScoreThreshold = mediumNativeScoreThreshold;
  }

  public double getBaseRelevance() {
    return baseRelevance;
  }

  public void setBaseRelevance(double baseRelevance) {
    this.baseRelevance = baseRelevance;
  }

  public double getTitleMatchWeight() {
    return titleMatchWeight;
  }

  public void setTitleMatchWeight(double titleMatchWeight) {
    this.titleMatchWeight = titleMatchWeight;
  }

  public double getContentMatchWeight() {
    return contentMatchWeight;
  }

  public void setContentMatchWeight(double contentMatchWeight) {
    this.contentMatchWeight = contentMatchWeight;
  }

  public double getNativeScoreWeight() {
    return nativeScoreWeight;
  }

  public void setNativeScoreWeight(double nativeScoreWeight) {
    this.nativeScoreWeight = nativeScoreWeight;
  }

  public int getMinContentLength() {
    return minContentLength;
  }

  public void setMinContentLength(int minContentLength) {
    this.minContentLength = minContentLength;
  }

  public int getMinTitleLength() {
    return minTitleLength;
  }

  public void setMinTitleLength(int minTitleLength) {
    this.minTitleLength = minTitleLength;
  }

  public double getMinNativeScore() {
    return minNativeScore;
  }

  public void setMinNativeScore(double minNativeScore) {
    this.minNativeScore = minNativeScore;
  }
}
