package dev.brainlift.generation;

/**
 * Text generation collaborator.
 *
 * <p>Failures are reported with the research error taxonomy: rate limits and server errors as
 * {@link dev.brainlift.research.TransientServiceException}, exhausted budgets as {@link
 * dev.brainlift.research.QuotaExceededException}, everything else as {@link
 * dev.brainlift.research.PermanentJobException}.
 */
public interface GenerationClient {

  String complete(String prompt, GenerationOptions options);
}
