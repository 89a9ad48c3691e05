package dev.codescope.search.context;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Token-budgeted set of code references.
 *
 * @param tokenBudget the budget the window was filled against
 * @param tokensUsed estimated tokens of the accepted references, never above the budget
 * @param references accepted references in rank order
 * @param truncated whether at least one reference was left out for lack of budget
 * @param summary description of what was left out; present only when truncated
 */
public record ContextWindow(
    int tokenBudget,
    int tokensUsed,
    List<CodeReference> references,
    boolean truncated,
    @Nullable String summary) {

  public ContextWindow {
    references = List.copyOf(references);
  }
}
