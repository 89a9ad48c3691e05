package dev.codescope.api;

import dev.codescope.search.Candidate;
import dev.codescope.search.CodeReferenceResponse;
import dev.codescope.search.SearchPipeline;
import dev.codescope.search.SearchStats;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST adapter over {@link SearchPipeline}. Errors are mapped to Problem Details by {@code
 * GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api")
public class SearchController {

  private final SearchPipeline searchPipeline;

  public SearchController(SearchPipeline searchPipeline) {
    this.searchPipeline = searchPipeline;
  }

  @PostMapping("/search")
  public List<Candidate> search(@Valid @RequestBody SearchRequest request) {
    return searchPipeline.search(request.toQuery());
  }

  @PostMapping("/search/references")
  public CodeReferenceResponse searchReferences(@Valid @RequestBody SearchRequest request) {
    return searchPipeline.searchForCodeReferences(request.toQuery(), request.tokenBudget());
  }

  @GetMapping("/search/stats")
  public SearchStats stats() {
    return searchPipeline.getStats();
  }

  @PostMapping("/cache/invalidate")
  public InvalidationResponse invalidate(@RequestBody InvalidationRequest request) {
    boolean hasFile = request.filePath() != null && !request.filePath().isBlank();
    boolean hasLanguage = request.language() != null && !request.language().isBlank();
    if (!hasFile && !hasLanguage) {
      throw new IllegalArgumentException("filePath or language must be provided");
    }
    int removed = 0;
    if (hasFile) {
      removed += searchPipeline.invalidateFile(request.filePath());
    }
    if (hasLanguage) {
      removed += searchPipeline.invalidateLanguage(request.language());
    }
    return new InvalidationResponse(removed);
  }

  @DeleteMapping("/cache")
  public ResponseEntity<Void> clearCaches() {
    searchPipeline.clearCaches();
    return ResponseEntity.noContent().build();
  }
}
