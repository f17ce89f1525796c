package dev.brainlift.pipeline;

import dev.brainlift.research.ResearchCategory;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Static table of {@link CategoryProfile}s, one per {@link ResearchCategory}. */
public final class CategoryProfiles {

  static final List<String> ACADEMIC_DOMAINS =
      List.of(
          "edu", "ac.uk", "researchgate.net", "scholar.google.com", "arxiv.org", "ieee.org",
          "acm.org", "springer.com", "nature.com", "sciencedirect.com", "jstor.org",
          "pubmed.ncbi.nlm.nih.gov");

  static final List<String> INDUSTRY_DOMAINS =
      List.of(
          "mckinsey.com", "bcg.com", "deloitte.com", "pwc.com", "hbr.org", "mit.edu",
          "stanford.edu", "harvard.edu", "wharton.upenn.edu", "kellogg.northwestern.edu");

  static final List<String> CONTRARIAN_DOMAINS =
      List.of(
          "marginalrevolution.com", "overcomingbias.com", "lesswrong.com", "slatestarcodex.com",
          "astralcodexten.substack.com", "econlog.econlib.org", "theatlantic.com",
          "newyorker.com", "medium.com", "substack.com");

  static final List<String> LOW_SIGNAL_DOMAINS = List.of("wikipedia.org", "reddit.com", "quora.com");

  private static final int MAX_TOKENS = 1500;

  private static final Map<ResearchCategory, CategoryProfile> PROFILES =
      new EnumMap<>(ResearchCategory.class);

  static {
    List<String> expertDomains = new ArrayList<>(ACADEMIC_DOMAINS);
    expertDomains.addAll(INDUSTRY_DOMAINS);
    register(
        new CategoryProfile(
            ResearchCategory.EXPERTS, expertDomains, LOW_SIGNAL_DOMAINS, true, 0.3, MAX_TOKENS));
    register(
        new CategoryProfile(
            ResearchCategory.CONTRARIAN_VIEWS,
            CONTRARIAN_DOMAINS,
            List.of(),
            false,
            0.4,
            MAX_TOKENS));
    register(
        new CategoryProfile(
            ResearchCategory.KNOWLEDGE_MAP, List.of(), List.of(), false, 0.3, MAX_TOKENS));
  }

  private CategoryProfiles() {}

  public static CategoryProfile forCategory(ResearchCategory category) {
    CategoryProfile profile = PROFILES.get(category);
    if (profile == null) {
      throw new IllegalArgumentException("No profile registered for category " + category);
    }
    return profile;
  }

  private static void register(CategoryProfile profile) {
    PROFILES.put(profile.category(), profile);
  }
}
