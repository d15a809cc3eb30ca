package com.securebeacon.model.analysis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * One page of encrypted analyses as returned by {@code GET /api/analyses}.
 *
 * @param items the records on this page, never null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalysisPage(List<EncryptedAnalysisRecord> items) {

  /**
   * Normalizes a missing item list to an empty one.
   */
  public AnalysisPage {
    items = items == null ? List.of() : List.copyOf(items);
  }
}
