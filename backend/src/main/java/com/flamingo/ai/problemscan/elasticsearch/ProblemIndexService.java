package com.flamingo.ai.problemscan.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.TextQueryType;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import com.flamingo.ai.problemscan.exception.SearchException;
import com.flamingo.ai.problemscan.service.matching.CandidateRetriever;
import com.flamingo.ai.problemscan.service.model.CandidateProblem;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch-backed candidate retrieval over the {@code problems} index.
 *
 * <p>The index is written by the problem importer; this service only creates it when missing and
 * runs tenant-scoped full-text queries against it. Search failures are not masked: they surface as
 * {@link SearchException} so the caller can degrade per segment.
 */
@Service
@Slf4j
public class ProblemIndexService implements CandidateRetriever {

  private final ElasticsearchClient elasticsearchClient;
  private final MeterRegistry meterRegistry;
  private final String indexName;

  public ProblemIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      @Value("${elasticsearch.index.problems:problems}") String indexName) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
    this.indexName = indexName;
  }

  @PostConstruct
  public void initIndex() {
    try {
      var indices = elasticsearchClient.indices();
      if (indices == null) {
        log.warn(
            "Elasticsearch client not available, skipping index initialization for {}",
            indexName);
        return;
      }
      boolean exists = indices.exists(e -> e.index(indexName)).value();
      if (!exists) {
        indices.create(
            CreateIndexRequest.of(
                c ->
                    c.index(indexName)
                        .mappings(
                            m -> m.dynamic(DynamicMapping.False).properties(defineProperties()))));
        log.info("Created Elasticsearch index: {}", indexName);
      } else {
        log.debug("Elasticsearch index '{}' already exists", indexName);
      }
    } catch (IOException | ElasticsearchException e) {
      log.error("Failed to initialize Elasticsearch index '{}': {}", indexName, e.getMessage(), e);
      throw new IllegalStateException(
          "Failed to initialize Elasticsearch index '" + indexName + "'", e);
    }
  }

  @Override
  @Timed(value = "scan.retrieval", description = "Time for candidate full-text search")
  @CircuitBreaker(name = "elasticsearch")
  public List<CandidateProblem> search(String text, String tenantId, int limit) {
    if (text == null || text.isBlank() || limit <= 0) {
      return List.of();
    }

    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(indexName)
                    .query(
                        q ->
                            q.bool(
                                b ->
                                    b.filter(f -> f.term(t -> t.field("tenantId").value(tenantId)))
                                        .must(
                                            m ->
                                                m.multiMatch(
                                                    mm ->
                                                        mm.fields("content^1.0", "title^0.5")
                                                            .query(text)
                                                            .type(TextQueryType.BestFields)
                                                            .tieBreaker(0.3)))))
                    .size(limit));

    try {
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<CandidateProblem> candidates = new ArrayList<>();
      for (Hit<Map> hit : response.hits().hits()) {
        candidates.add(fromHit(hit));
      }
      log.debug(
          "[problemSearch] index={} tenant={} returned={}", indexName, tenantId, candidates.size());
      meterRegistry.counter("scan.retrieval.search").increment();
      return candidates;
    } catch (IOException | ElasticsearchException e) {
      log.error("Problem search failed for tenant {}: {}", tenantId, e.getMessage());
      meterRegistry.counter("scan.retrieval.errors").increment();
      throw new SearchException("Problem search failed", e);
    }
  }

  public String getIndexName() {
    return indexName;
  }

  private Map<String, Property> defineProperties() {
    Map<String, Property> properties = new HashMap<>();
    properties.put("id", Property.of(p -> p.keyword(k -> k)));
    properties.put("tenantId", Property.of(p -> p.keyword(k -> k)));
    properties.put("title", Property.of(p -> p.text(t -> t.analyzer("english"))));
    properties.put("content", Property.of(p -> p.text(t -> t.analyzer("english"))));
    properties.put("subject", Property.of(p -> p.keyword(k -> k)));
    properties.put("category", Property.of(p -> p.keyword(k -> k)));
    properties.put("examType", Property.of(p -> p.keyword(k -> k)));
    properties.put("examYear", Property.of(p -> p.integer(i -> i)));
    properties.put("problemNumber", Property.of(p -> p.integer(i -> i)));
    properties.put("difficulty", Property.of(p -> p.keyword(k -> k)));
    return properties;
  }

  static CandidateProblem fromHit(Hit<Map> hit) {
    Map<String, Object> source = hit.source() == null ? Map.of() : hit.source();
    Object id = source.get("id");
    return CandidateProblem.builder()
        .id(id != null ? id.toString() : hit.id())
        .tenantId(asString(source.get("tenantId")))
        .title(asString(source.get("title")))
        .content(asString(source.get("content")))
        .subject(asString(source.get("subject")))
        .category(asString(source.get("category")))
        .examType(asString(source.get("examType")))
        .examYear(asInteger(source.get("examYear")))
        .problemNumber(asInteger(source.get("problemNumber")))
        .difficulty(asString(source.get("difficulty")))
        .relevanceScore(hit.score() != null ? hit.score() : 0.0)
        .build();
  }

  private static String asString(Object value) {
    return value == null ? null : value.toString();
  }

  private static Integer asInteger(Object value) {
    return value instanceof Number n ? n.intValue() : null;
  }
}
