package dev.brainlift.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class KeyQuoteExtractorTest {

  @Test
  void prefersSentencesWithEvidencePhrases() {
    String content =
        "Distributed databases replicate data across many machines for durability. "
            + "Research shows that leader-based consensus simplifies failure handling. "
            + "Teams often choose Raft for this reason.";

    List<String> quotes = KeyQuoteExtractor.extract(content);

    assertThat(quotes)
        .containsExactly("Research shows that leader-based consensus simplifies failure handling");
  }

  @Test
  void keepsAtMostThreeQuotes() {
    String content =
        "A study found that X improves Y in practice. "
            + "According to the survey most teams use Z daily. "
            + "Evidence suggests the trend will continue next year. "
            + "Experts believe adoption will double soon enough.";

    assertThat(KeyQuoteExtractor.extract(content)).hasSize(3);
  }

  @Test
  void fallsBackToMidLengthSentences() {
    String shortSentence = "Too short to matter here";
    String midSentence =
        "Replicated state machines are the foundation of most fault tolerant storage systems";
    String content = shortSentence + ". " + midSentence + ". ";

    assertThat(KeyQuoteExtractor.extract(content)).containsExactly(midSentence);
  }

  @Test
  void returnsNothingForContentWithoutSentences() {
    assertThat(KeyQuoteExtractor.extract("tiny. text!")).isEmpty();
  }
}
