package dev.codescope.search.rerank;

import static dev.codescope.fixture.CandidateBuilder.candidate;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;

import dev.codescope.search.Candidate;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CrossEncoderRerankerTest {

  @Mock ScoringModel scoringModel;

  private CrossEncoderReranker reranker;

  private final List<Candidate> shortlist =
      List.of(
          candidate("a").content("text A").build(),
          candidate("b").content("text B").build(),
          candidate("c").content("text C").build());

  @BeforeEach
  void setUp() {
    reranker = new CrossEncoderReranker(scoringModel, true);
  }

  @Test
  void ordersEntriesByModelScore() {
    given(scoringModel.scoreAll(anyList(), eq("token refresh")))
        .willReturn(Response.from(List.of(0.2, 0.9, 0.5)));

    RerankResponse response = reranker.rerank("token refresh", shortlist, 10);

    assertThat(response.reranked()).isTrue();
    assertThat(response.entries())
        .extracting(RerankedEntry::chunkId)
        .containsExactly("b", "c", "a");
    assertThat(response.entries().get(0).rerankScore()).isEqualTo(0.9);
  }

  @Test
  void respectsMaxResults() {
    given(scoringModel.scoreAll(anyList(), anyString()))
        .willReturn(Response.from(List.of(0.2, 0.9, 0.5)));

    RerankResponse response = reranker.rerank("q", shortlist, 2);

    assertThat(response.entries()).extracting(RerankedEntry::chunkId).containsExactly("b", "c");
  }

  @Test
  void scoreCountMismatchFails() {
    given(scoringModel.scoreAll(anyList(), anyString()))
        .willReturn(Response.from(List.of(0.2)));

    assertThatThrownBy(() -> reranker.rerank("q", shortlist, 10))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("Scoring model returned 1 scores for 3 candidates");
  }

  @Test
  void propagatesModelFailure() {
    given(scoringModel.scoreAll(anyList(), anyString()))
        .willThrow(new RuntimeException("ONNX model error"));

    assertThatThrownBy(() -> reranker.rerank("q", shortlist, 10))
        .isInstanceOf(RuntimeException.class)
        .hasMessage("ONNX model error");
  }

  @Test
  void emptyShortlistDoesNotCallModel() {
    RerankResponse response = reranker.rerank("q", List.of(), 10);

    assertThat(response.reranked()).isFalse();
    verifyNoInteractions(scoringModel);
  }

  @Test
  void segmentPrefixesLocationAndNames() {
    Candidate method =
        candidate("m1")
            .file("src/auth/session.ts")
            .className("SessionStore")
            .functionName("refresh")
            .content("refresh() { }")
            .build();

    TextSegment segment = CrossEncoderReranker.toSegment(method);

    assertThat(segment.text()).isEqualTo("src/auth/session.ts SessionStore refresh\nrefresh() { }");
    assertThat(segment.metadata().getString("chunk_id")).isEqualTo("m1");
  }
}
