package dev.juris.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import dev.langchain4j.data.document.Metadata;
import java.util.List;
import org.junit.jupiter.api.Test;

class FusionRankerTest {

  private static final FusionWeights EQUAL = new FusionWeights(0.5, 0.5);

  // --- Helper factory methods ---

  private static RankedCandidate candidate(String id, double score) {
    return new RankedCandidate(id, "text " + id, score, new Metadata().put("article", id));
  }

  // --- Test cases ---

  @Test
  void empty_inputs_return_empty_result() {
    assertThat(FusionRanker.fuse(List.of(), List.of(), FusionWeights.DEFAULT)).isEmpty();
  }

  @Test
  void item_in_both_lists_outscores_item_in_one_list() {
    List<SearchResult> fused =
        FusionRanker.fuse(List.of(candidate("both", 9.0)), List.of(candidate("both", 0.8)), EQUAL);
    List<SearchResult> alone =
        FusionRanker.fuse(List.of(), List.of(candidate("solo", 1.0)), EQUAL);

    assertThat(fused).hasSize(1);
    assertThat(fused.get(0).score()).isGreaterThan(alone.get(0).score());
  }

  @Test
  void rank_zero_in_both_lists_beats_rank_zero_in_one() {
    List<RankedCandidate> keyword = List.of(candidate("shared", 3.0), candidate("kwOnly", 2.0));
    List<RankedCandidate> semantic = List.of(candidate("semOnly", 0.95), candidate("shared", 0.9));
    List<RankedCandidate> keywordTop = List.of(candidate("shared", 3.0));
    List<RankedCandidate> semanticTop = List.of(candidate("shared", 0.9));

    List<SearchResult> bothAtTop = FusionRanker.fuse(keywordTop, semanticTop, EQUAL);
    List<SearchResult> mixed = FusionRanker.fuse(keyword, semantic, EQUAL);

    assertThat(bothAtTop.get(0).score()).isCloseTo(0.5 / 61 + 0.5 / 61, within(1e-12));
    assertThat(mixed.get(0).id()).isEqualTo("shared");
    assertThat(mixed.get(0).score()).isCloseTo(0.5 / 61 + 0.5 / 62, within(1e-12));
  }

  @Test
  void contributions_use_reciprocal_rank_with_list_weight() {
    List<SearchResult> results =
        FusionRanker.fuse(
            List.of(candidate("k0", 10.0), candidate("k1", 5.0)),
            List.of(candidate("s0", 0.9)),
            FusionWeights.DEFAULT);

    assertThat(results).extracting(SearchResult::id).containsExactly("s0", "k0", "k1");
    assertThat(results.get(0).score()).isCloseTo(0.7 / 61, within(1e-12));
    assertThat(results.get(1).score()).isCloseTo(0.3 / 61, within(1e-12));
    assertThat(results.get(2).score()).isCloseTo(0.3 / 62, within(1e-12));
  }

  @Test
  void raw_scores_do_not_influence_fusion() {
    List<SearchResult> results =
        FusionRanker.fuse(List.of(candidate("a", 1000.0), candidate("b", 0.001)), List.of(), EQUAL);

    assertThat(results.get(0).score() / results.get(1).score())
        .isCloseTo(62.0 / 61.0, within(1e-12));
  }

  @Test
  void custom_damping_constant_is_applied() {
    List<SearchResult> results =
        FusionRanker.fuse(List.of(candidate("a", 1.0)), List.of(), new FusionWeights(1.0, 1.0), 1);

    assertThat(results.get(0).score()).isCloseTo(0.5, within(1e-12));
  }

  @Test
  void metadata_and_content_are_carried_through() {
    List<SearchResult> results = FusionRanker.fuse(List.of(candidate("7", 1.0)), List.of(), EQUAL);

    assertThat(results.get(0).content()).isEqualTo("text 7");
    assertThat(results.get(0).metadata().getString("article")).isEqualTo("7");
  }

  @Test
  void rejects_non_positive_damping_constant() {
    assertThatThrownBy(() -> FusionRanker.fuse(List.of(), List.of(), EQUAL, 0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void query_type_selects_weights() {
    FusionWeights configured = new FusionWeights(0.6, 0.4);

    assertThat(FusionWeights.forQueryType(QueryType.CITATION, configured))
        .isEqualTo(new FusionWeights(0.3, 0.7));
    assertThat(FusionWeights.forQueryType(QueryType.CONCEPTUAL, configured))
        .isEqualTo(new FusionWeights(0.8, 0.2));
    assertThat(FusionWeights.forQueryType(QueryType.COMPARATIVE, configured))
        .isEqualTo(new FusionWeights(0.8, 0.2));
    assertThat(FusionWeights.forQueryType(QueryType.PROCEDURAL, configured))
        .isEqualTo(new FusionWeights(0.6, 0.4));
    assertThat(FusionWeights.forQueryType(QueryType.DEFINITION, configured)).isSameAs(configured);
    assertThat(FusionWeights.forQueryType(null, configured)).isSameAs(configured);
  }

  @Test
  void rejects_weights_outside_unit_interval() {
    assertThatThrownBy(() -> new FusionWeights(1.2, 0.3))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void query_type_wire_names_round_trip_through_fromValue() {
    assertThat(QueryType.fromValue("document analysis")).isEqualTo(QueryType.DOCUMENT_ANALYSIS);
    assertThatThrownBy(() -> QueryType.fromValue("unknown"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
