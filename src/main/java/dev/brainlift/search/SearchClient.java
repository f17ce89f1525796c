package dev.brainlift.search;

import java.util.List;

/**
 * Web search collaborator.
 *
 * <p>Implementations throw {@link dev.brainlift.research.TransientServiceException} for failures
 * worth retrying, {@link dev.brainlift.research.QuotaExceededException} when the service budget is
 * spent and {@link dev.brainlift.research.PermanentJobException} otherwise.
 */
public interface SearchClient {

  List<SearchHit> search(String query, SearchFilters filters);

  /** Number of search calls issued so far. */
  long requestCount();
}
