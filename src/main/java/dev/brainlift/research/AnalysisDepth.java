package dev.brainlift.research;

/** How thoroughly the search stage explores a topic. */
public enum AnalysisDepth {
  BASIC("basic"),
  ADVANCED("advanced");

  private final String apiValue;

  AnalysisDepth(String apiValue) {
    this.apiValue = apiValue;
  }

  public String apiValue() {
    return apiValue;
  }
}
