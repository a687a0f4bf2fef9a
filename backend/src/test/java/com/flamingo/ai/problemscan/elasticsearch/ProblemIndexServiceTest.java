package com.flamingo.ai.problemscan.elasticsearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.query_dsl.BoolQuery;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.ElasticsearchIndicesClient;
import co.elastic.clients.transport.endpoints.BooleanResponse;
import com.flamingo.ai.problemscan.exception.SearchException;
import com.flamingo.ai.problemscan.service.model.CandidateProblem;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ProblemIndexService Tests")
@SuppressWarnings({"rawtypes", "unchecked"})
class ProblemIndexServiceTest {

  @Mock private ElasticsearchClient elasticsearchClient;
  @Mock private ElasticsearchIndicesClient indicesClient;

  private SimpleMeterRegistry meterRegistry;
  private ProblemIndexService service;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    service = new ProblemIndexService(elasticsearchClient, meterRegistry, "problems");
  }

  @Test
  @DisplayName("Should query the tenant's problems and map hits in engine order")
  void shouldQueryTenantProblems() throws Exception {
    Hit<Map> first =
        Hit.of(
            h ->
                h.index("problems")
                    .id("es-1")
                    .score(7.5)
                    .source(
                        Map.of(
                            "id", "amc10-2019-a-1",
                            "tenantId", "tenant-a",
                            "title", "AMC 10A 2019 Problem 1",
                            "content", "What is the value of 2^(0^(1^9))?",
                            "examYear", 2019,
                            "problemNumber", 1)));
    Hit<Map> second = Hit.of(h -> h.index("problems").id("es-2").score(3.1).source(Map.of()));
    SearchResponse<Map> response =
        SearchResponse.of(
            r ->
                r.took(3)
                    .timedOut(false)
                    .shards(s -> s.total(1).successful(1).failed(0))
                    .hits(hm -> hm.hits(List.of(first, second))));
    when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class)))
        .thenReturn(response);

    List<CandidateProblem> candidates = service.search("value of 2^0", "tenant-a", 10);

    ArgumentCaptor<SearchRequest> captor = ArgumentCaptor.forClass(SearchRequest.class);
    verify(elasticsearchClient).search(captor.capture(), eq(Map.class));
    SearchRequest request = captor.getValue();
    BoolQuery bool = request.query().bool();
    assertThat(request.index()).containsExactly("problems");
    assertThat(request.size()).isEqualTo(10);
    assertThat(bool.filter().get(0).term().field()).isEqualTo("tenantId");
    assertThat(bool.filter().get(0).term().value().stringValue()).isEqualTo("tenant-a");
    assertThat(bool.must().get(0).multiMatch().fields())
        .containsExactly("content^1.0", "title^0.5");

    assertThat(candidates).extracting(CandidateProblem::getId)
        .containsExactly("amc10-2019-a-1", "es-2");
    assertThat(candidates.get(0).getExamYear()).isEqualTo(2019);
    assertThat(candidates.get(0).getProblemNumber()).isEqualTo(1);
    assertThat(candidates.get(0).getRelevanceScore()).isEqualTo(7.5);
  }

  @Test
  @DisplayName("Should not query for blank text")
  void shouldNotQueryForBlankText() {
    assertThat(service.search("  ", "tenant-a", 10)).isEmpty();
    verifyNoInteractions(elasticsearchClient);
  }

  @Test
  @DisplayName("Should wrap transport failures in SearchException")
  void shouldWrapTransportFailures() throws Exception {
    when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class)))
        .thenThrow(new IOException("connection refused"));

    assertThatThrownBy(() -> service.search("prime", "tenant-a", 10))
        .isInstanceOf(SearchException.class)
        .hasCauseInstanceOf(IOException.class);
    assertThat(meterRegistry.counter("scan.retrieval.errors").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should create the index when missing")
  void shouldCreateIndexWhenMissing() throws Exception {
    when(elasticsearchClient.indices()).thenReturn(indicesClient);
    when(indicesClient.exists(any(Function.class))).thenReturn(new BooleanResponse(false));

    service.initIndex();

    verify(indicesClient).create(any(CreateIndexRequest.class));
  }

  @Test
  @DisplayName("Should leave an existing index untouched")
  void shouldLeaveExistingIndex() throws Exception {
    when(elasticsearchClient.indices()).thenReturn(indicesClient);
    when(indicesClient.exists(any(Function.class))).thenReturn(new BooleanResponse(true));

    service.initIndex();

    verify(indicesClient, never()).create(any(CreateIndexRequest.class));
  }
}
