package dev.brainlift.pipeline;

import dev.brainlift.research.ResearchCategory;
import dev.brainlift.research.Source;
import java.util.List;
import java.util.stream.Collectors;

/** Category-specific generation prompts built from the selected sources. */
final class PromptTemplates {

  private PromptTemplates() {}

  static String build(ResearchCategory category, String purpose, List<Source> sources) {
    return switch (category) {
      case EXPERTS -> expertPrompt(purpose, sources);
      case CONTRARIAN_VIEWS -> contrarianPrompt(purpose, sources);
      case KNOWLEDGE_MAP -> knowledgeMapPrompt(purpose, sources);
    };
  }

  private static String expertPrompt(String purpose, List<Source> sources) {
    return """
        Create an Experts section for a BrainLift document using these sources.

        Purpose: %s

        Sources:
        %s

        For each expert identified, provide:
        1. Name and credentials
        2. Their specific expertise area
        3. Why they're relevant to this purpose
        4. Key insights or notable work
        5. How to contact or find their work

        Focus on credible experts with relevant experience and documented expertise.
        Format as structured sections for each expert.
        """
        .formatted(purpose, describe(sources, true));
  }

  private static String contrarianPrompt(String purpose, List<Source> sources) {
    return """
        Create a SpikyPOV section for a BrainLift document using these sources.

        Purpose: %s

        Sources:
        %s

        Format:
        1. Consensus View: what most people believe about this topic
        2. Contrarian Insight: the counter-consensus view with evidence
        3. Supporting Evidence: specific data, studies and examples from the sources
        4. Practical Implications: what this means for the purpose

        Focus on evidence-backed contrarian viewpoints, not mere opinions.
        Use multiple perspectives and cite specific evidence from the sources.
        """
        .formatted(purpose, describe(sources, false));
  }

  private static String knowledgeMapPrompt(String purpose, List<Source> sources) {
    return """
        Create a Knowledge Tree section for a BrainLift document using these sources.

        Purpose: %s

        Sources:
        %s

        Analyze and organize:
        1. Current State: what systems, tools and approaches currently exist
        2. Strengths and Weaknesses: what works well and what doesn't
        3. Adjacent Fields: related areas and disciplines
        4. Background Concepts: foundational knowledge needed
        5. Dependencies: what this area depends on or influences

        Structure as a comprehensive knowledge map with clear connections and relationships.
        """
        .formatted(purpose, describe(sources, false));
  }

  private static String describe(List<Source> sources, boolean withAuthor) {
    return sources.stream()
        .map(
            source -> {
              StringBuilder entry = new StringBuilder();
              entry.append("- ").append(source.title()).append(" (").append(source.url()).append(")\n");
              if (withAuthor) {
                entry
                    .append("  Author: ")
                    .append(source.author() == null ? "Unknown" : source.author())
                    .append('\n');
              }
              entry.append("  Summary: ").append(source.summary()).append('\n');
              entry.append("  Key Quotes: ").append(String.join("; ", source.keyQuotes()));
              return entry.toString();
            })
        .collect(Collectors.joining("\n"));
  }
}
