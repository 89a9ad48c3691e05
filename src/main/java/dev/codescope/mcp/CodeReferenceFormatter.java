package dev.codescope.mcp;

import dev.codescope.search.Candidate;
import dev.codescope.search.CodeReferenceResponse;
import dev.codescope.search.SearchMetadata;
import dev.codescope.search.context.CodeReference;
import dev.codescope.search.context.ContextWindow;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Renders search output as Markdown text blocks for MCP clients: a heading with the file location
 * and chunk kind, the scores, then the code in a fenced block tagged with its language.
 *
 * @see McpToolService
 */
@Component
public class CodeReferenceFormatter {

  /** Formats a ranked candidate list, one numbered block per candidate. */
  public String formatCandidates(List<Candidate> candidates) {
    StringBuilder output = new StringBuilder();
    for (int i = 0; i < candidates.size(); i++) {
      Candidate candidate = candidates.get(i);
      output.append(
          "## [%d] %s:%d-%d (%s, %s)\n"
              .formatted(
                  i + 1,
                  candidate.filePath(),
                  candidate.startLine(),
                  candidate.endLine(),
                  candidate.chunkKind().value(),
                  candidate.language()));
      output.append(scoreLine(candidate));
      output.append(fenced(candidate.language(), candidate.content()));
    }
    return output.toString();
  }

  /** Formats an assembled window followed by its truncation summary and request metadata. */
  public String formatReferences(CodeReferenceResponse response) {
    ContextWindow window = response.window();
    StringBuilder output = new StringBuilder();
    List<CodeReference> references = window.references();
    for (int i = 0; i < references.size(); i++) {
      CodeReference reference = references.get(i);
      output.append(
          "## [%d] %s:%d-%d (%s, %s)\n"
              .formatted(
                  i + 1,
                  reference.filePath(),
                  reference.startLine(),
                  reference.endLine(),
                  reference.dominantChunkKind().value(),
                  reference.language()));
      output.append(
          String.format(
              Locale.ROOT,
              "Score: %.3f | Chunks: %d%s\n",
              reference.averageScore(),
              reference.memberCount(),
              entityName(reference)));
      output.append(fenced(reference.language(), reference.mergedText()));
    }
    if (window.truncated() && window.summary() != null) {
      output.append("_").append(window.summary()).append("_\n\n");
    }
    SearchMetadata metadata = response.metadata();
    output.append(
        "Tokens: %d/%d | Results: %d | %d ms | cache hit: %s | hybrid: %s | reranked: %s\n"
            .formatted(
                window.tokensUsed(),
                window.tokenBudget(),
                metadata.totalResults(),
                metadata.elapsedMs(),
                yesNo(metadata.cacheHit()),
                yesNo(metadata.hybridUsed()),
                yesNo(metadata.reranked())));
    return output.toString();
  }

  private static String scoreLine(Candidate candidate) {
    StringBuilder line = new StringBuilder();
    line.append(String.format(Locale.ROOT, "Score: %.3f", candidate.score()));
    if (candidate.rerankScore() != null) {
      line.append(String.format(Locale.ROOT, " | Rerank: %.3f", candidate.rerankScore()));
    }
    if (candidate.functionName() != null) {
      line.append(" | Function: ").append(candidate.functionName());
    } else if (candidate.className() != null) {
      line.append(" | Class: ").append(candidate.className());
    }
    return line.append('\n').toString();
  }

  private static String entityName(CodeReference reference) {
    if (reference.functionName() != null) {
      return " | Function: " + reference.functionName();
    }
    if (reference.className() != null) {
      return " | Class: " + reference.className();
    }
    return "";
  }

  private static String fenced(String language, String code) {
    return "\n```" + language + "\n" + code + "\n```\n\n---\n";
  }

  private static String yesNo(boolean value) {
    return value ? "yes" : "no";
  }
}
