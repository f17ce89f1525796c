package dev.brainlift.research;

/**
 * The closed set of research sections a job can produce.
 *
 * <p>Adding a category means extending this enum together with the category tables in {@code
 * dev.brainlift.pipeline.CategoryProfiles} and {@code dev.brainlift.pipeline.PromptTemplates}.
 */
public enum ResearchCategory {
  EXPERTS("experts", "Experts"),
  CONTRARIAN_VIEWS("contrarianViews", "Spiky POVs"),
  KNOWLEDGE_MAP("knowledgeMap", "Knowledge Tree");

  private final String key;
  private final String sectionTitle;

  ResearchCategory(String key, String sectionTitle) {
    this.key = key;
    this.sectionTitle = sectionTitle;
  }

  /** Stable identifier used in job ids and logs. */
  public String key() {
    return key;
  }

  /** Title of the document section this category fills. */
  public String sectionTitle() {
    return sectionTitle;
  }

  /**
   * Resolve a category from its key ({@code contrarianViews}) or constant name ({@code
   * CONTRARIAN_VIEWS}), ignoring case.
   *
   * @throws IllegalArgumentException if nothing matches
   */
  public static ResearchCategory fromKey(String value) {
    for (ResearchCategory category : values()) {
      if (category.key.equalsIgnoreCase(value) || category.name().equalsIgnoreCase(value)) {
        return category;
      }
    }
    throw new IllegalArgumentException("Unknown research category: " + value);
  }
}
