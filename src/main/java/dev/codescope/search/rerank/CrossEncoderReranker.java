package dev.codescope.search.rerank;

import dev.codescope.search.Candidate;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Reranker backed by an in-process cross-encoder {@link ScoringModel} (e.g. ONNX
 * ms-marco-MiniLM-L-6-v2).
 *
 * <p>Scores every query/chunk pair and returns the top {@code maxResults} by score. The file path
 * and enclosing names are prepended to the chunk text so the model sees where the code lives.
 *
 * <p>Model failures propagate to the caller.
 *
 * @see dev.langchain4j.model.scoring.ScoringModel
 */
public class CrossEncoderReranker implements Reranker {

  private final ScoringModel scoringModel;
  private final boolean enabled;

  public CrossEncoderReranker(ScoringModel scoringModel, boolean enabled) {
    this.scoringModel = scoringModel;
    this.enabled = enabled;
  }

  @Override
  public boolean isEnabled() {
    return enabled;
  }

  @Override
  public RerankResponse rerank(String query, List<Candidate> shortlist, int maxResults) {
    if (shortlist.isEmpty()) {
      return RerankResponse.notReranked();
    }

    List<TextSegment> segments = shortlist.stream().map(CrossEncoderReranker::toSegment).toList();
    Response<List<Double>> scores = scoringModel.scoreAll(segments, query);
    List<Double> content = scores.content();
    if (content == null || content.size() != shortlist.size()) {
      throw new IllegalStateException(
          "Scoring model returned "
              + (content == null ? 0 : content.size())
              + " scores for "
              + shortlist.size()
              + " candidates");
    }

    List<RerankedEntry> entries =
        IntStream.range(0, shortlist.size())
            .mapToObj(i -> RerankedEntry.of(shortlist.get(i).chunkId(), content.get(i)))
            .sorted(Comparator.comparingDouble(RerankedEntry::rerankScore).reversed())
            .limit(maxResults)
            .toList();
    return new RerankResponse(true, entries);
  }

  static TextSegment toSegment(Candidate candidate) {
    StringBuilder text = new StringBuilder();
    text.append(candidate.filePath());
    if (candidate.className() != null) {
      text.append(' ').append(candidate.className());
    }
    if (candidate.functionName() != null) {
      text.append(' ').append(candidate.functionName());
    }
    text.append('\n').append(candidate.content());
    return TextSegment.from(text.toString(), Metadata.from("chunk_id", candidate.chunkId()));
  }
}
