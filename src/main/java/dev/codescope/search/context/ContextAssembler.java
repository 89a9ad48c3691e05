package dev.codescope.search.context;

import dev.codescope.search.Candidate;
import dev.codescope.search.ChunkKind;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Packs ranked candidates into a {@link ContextWindow}.
 *
 * <p>Consecutive candidates from the same file whose start line falls 0 to 10 lines after the
 * group's end are merged into one {@link CodeReference}. References are then accepted in rank
 * order until the next one would overflow the budget; nothing after that point is included, not
 * even a smaller reference that would still fit.
 *
 * <p>Token cost is estimated as {@code ceil(chars / 3.5)}.
 */
@Component
public class ContextAssembler {

  private static final Logger log = LoggerFactory.getLogger(ContextAssembler.class);

  static final double CHARS_PER_TOKEN = 3.5;
  static final int MAX_GROUP_GAP_LINES = 10;
  static final int GAP_MARKER_THRESHOLD_LINES = 3;
  static final String GAP_MARKER = "... (gap) ...";
  static final int SUMMARY_KIND_LIMIT = 3;

  private final ContextProperties contextProperties;

  public ContextAssembler(ContextProperties contextProperties) {
    this.contextProperties = contextProperties;
  }

  /** Assembles against the configured default budget. */
  public ContextWindow assemble(List<Candidate> rankedCandidates) {
    return assemble(rankedCandidates, contextProperties.defaultTokenBudget());
  }

  /**
   * Assembles the candidates into a window of at most {@code tokenBudget} estimated tokens.
   *
   * @param rankedCandidates candidates in rank order
   * @param tokenBudget the budget, must be positive
   * @return the filled window
   */
  public ContextWindow assemble(List<Candidate> rankedCandidates, int tokenBudget) {
    if (tokenBudget <= 0) {
      throw new IllegalArgumentException("tokenBudget must be positive, got: " + tokenBudget);
    }

    List<List<Candidate>> groups = group(rankedCandidates);
    List<CodeReference> references = new ArrayList<>();
    int used = 0;
    int accepted = 0;
    for (List<Candidate> group : groups) {
      CodeReference reference = toReference(group);
      int cost = estimateTokens(reference.mergedText());
      if (used + cost > tokenBudget) {
        break;
      }
      references.add(reference);
      used += cost;
      accepted++;
    }

    boolean truncated = accepted < groups.size();
    String summary = truncated ? summarize(groups.subList(accepted, groups.size())) : null;
    log.debug(
        "Assembled {} references using {}/{} tokens{}",
        references.size(),
        used,
        tokenBudget,
        truncated ? " (truncated)" : "");
    return new ContextWindow(tokenBudget, used, references, truncated, summary);
  }

  static int estimateTokens(String text) {
    return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
  }

  /** Splits the ranking into runs of nearby chunks from the same file. */
  static List<List<Candidate>> group(List<Candidate> rankedCandidates) {
    List<List<Candidate>> groups = new ArrayList<>();
    List<Candidate> current = new ArrayList<>();
    int groupEnd = 0;
    for (Candidate candidate : rankedCandidates) {
      if (!current.isEmpty() && joins(current.get(0), groupEnd, candidate)) {
        current.add(candidate);
        groupEnd = Math.max(groupEnd, candidate.endLine());
        continue;
      }
      if (!current.isEmpty()) {
        groups.add(current);
      }
      current = new ArrayList<>();
      current.add(candidate);
      groupEnd = candidate.endLine();
    }
    if (!current.isEmpty()) {
      groups.add(current);
    }
    return groups;
  }

  private static boolean joins(Candidate first, int groupEnd, Candidate next) {
    int gap = next.startLine() - groupEnd;
    return first.filePath().equals(next.filePath()) && gap >= 0 && gap <= MAX_GROUP_GAP_LINES;
  }

  static CodeReference toReference(List<Candidate> group) {
    List<Candidate> members =
        group.stream().sorted(Comparator.comparingInt(Candidate::startLine)).toList();
    Candidate first = members.get(0);
    Candidate last = members.get(members.size() - 1);
    Candidate dominant =
        group.stream().max(Comparator.comparingDouble(Candidate::score)).orElse(first);
    double averageScore = group.stream().mapToDouble(Candidate::score).average().orElse(0.0);
    int endLine = members.stream().mapToInt(Candidate::endLine).max().orElse(last.endLine());

    return new CodeReference(
        first.filePath(),
        first.startLine(),
        endLine,
        mergeText(members),
        averageScore,
        dominant.chunkKind(),
        dominant.language(),
        dominant.metadata(),
        dominant.functionName(),
        dominant.className(),
        members.size());
  }

  private static String mergeText(List<Candidate> members) {
    if (members.size() == 1) {
      return members.get(0).content();
    }
    StringBuilder text = new StringBuilder(members.get(0).content());
    int previousEnd = members.get(0).endLine();
    for (Candidate member : members.subList(1, members.size())) {
      text.append("\n\n");
      if (member.startLine() - previousEnd > GAP_MARKER_THRESHOLD_LINES) {
        text.append(GAP_MARKER).append("\n\n");
      }
      text.append(member.content());
      previousEnd = Math.max(previousEnd, member.endLine());
    }
    return text.toString();
  }

  /** e.g. {@code "7 additional results truncated from 4 files (function, class, method, ...)"}. */
  static String summarize(List<List<Candidate>> omittedGroups) {
    List<Candidate> omitted = omittedGroups.stream().flatMap(List::stream).toList();
    Set<String> files = new LinkedHashSet<>();
    Set<ChunkKind> kinds = new LinkedHashSet<>();
    for (Candidate candidate : omitted) {
      files.add(candidate.filePath());
      kinds.add(candidate.chunkKind());
    }
    String kindList =
        kinds.stream()
            .limit(SUMMARY_KIND_LIMIT)
            .map(ChunkKind::value)
            .collect(Collectors.joining(", "));
    if (kinds.size() > SUMMARY_KIND_LIMIT) {
      kindList += ", ...";
    }
    return "%d additional %s truncated from %d %s (%s)"
        .formatted(
            omitted.size(),
            omitted.size() == 1 ? "result" : "results",
            files.size(),
            files.size() == 1 ? "file" : "files",
            kindList);
  }
}
