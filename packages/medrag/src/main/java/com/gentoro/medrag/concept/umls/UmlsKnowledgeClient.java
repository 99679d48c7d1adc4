package com.gentoro.medrag.concept.umls;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.medrag.concept.ConceptDetails;
import com.gentoro.medrag.concept.ConceptKnowledgeClient;
import com.gentoro.medrag.concept.ConceptRelation;
import com.gentoro.medrag.concept.RelationKind;
import com.gentoro.medrag.config.MedRagSettings.UmlsSettings;
import com.gentoro.medrag.exception.AuthenticationException;
import com.gentoro.medrag.exception.ConfigException;
import com.gentoro.medrag.exception.NetworkException;
import com.gentoro.medrag.http.LoggingInterceptor;
import com.gentoro.medrag.utility.JacksonUtility;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * {@link ConceptKnowledgeClient} backed by the UMLS Terminology Services REST API.
 *
 * <p>Endpoints used, all under {@code content/current/CUI/{cui}}: the concept itself (name,
 * semantic types, atom and relation counts), {@code /definitions} and {@code /relations}. The API
 * key is sent as the {@code apiKey} query parameter.
 */
public class UmlsKnowledgeClient implements ConceptKnowledgeClient {
  private static final org.slf4j.Logger log =
      com.gentoro.medrag.logging.LoggingService.getLogger(UmlsKnowledgeClient.class);

  private final UmlsSettings settings;
  private final OkHttpClient http;
  private final HttpUrl baseUrl;
  private final AtomicBoolean missingKeyReported = new AtomicBoolean();

  public UmlsKnowledgeClient(UmlsSettings settings, OkHttpClient http) {
    this.settings = settings;
    this.http = http;
    this.baseUrl = HttpUrl.parse(settings.baseUrl());
    if (baseUrl == null) {
      throw new ConfigException("Invalid umls.baseUrl: " + settings.baseUrl());
    }
  }

  public boolean isAvailable() {
    return settings.apiKey() != null && !settings.apiKey().isBlank();
  }

  @Override
  public Optional<ConceptDetails> getDetails(String conceptId) {
    if (!available()) return Optional.empty();

    Optional<JsonNode> concept = fetch(conceptUrl(conceptId, null), "concept", conceptId);
    if (concept.isEmpty()) return Optional.empty();
    JsonNode result = concept.get().path("result");
    if (result.isMissingNode() || result.isNull()) {
      log.warn("UMLS concept response for {} has no result element", conceptId);
      return Optional.empty();
    }

    List<String> categories = new ArrayList<>();
    for (JsonNode type : result.path("semanticTypes")) {
      String name = type.path("name").asText("");
      if (!name.isBlank()) categories.add(name);
    }
    Map<String, Object> attributes = new LinkedHashMap<>();
    if (result.has("atomCount")) attributes.put("atomCount", result.path("atomCount").asLong());
    if (result.has("relationCount")) {
      attributes.put("relationCount", result.path("relationCount").asLong());
    }

    return Optional.of(
        new ConceptDetails(
            conceptId,
            result.path("name").asText(conceptId),
            categories,
            definitions(conceptId),
            attributes));
  }

  @Override
  public List<ConceptRelation> getRelations(String conceptId) {
    if (!available()) return List.of();

    Optional<JsonNode> response =
        fetch(conceptUrl(conceptId, "relations"), "relations", conceptId);
    if (response.isEmpty()) return List.of();

    List<ConceptRelation> out = new ArrayList<>();
    int discarded = 0;
    for (JsonNode item : response.get().path("result")) {
      String label = item.path("relationLabel").asText("").trim().toUpperCase();
      RelationKind kind;
      if (settings.broaderLabels().contains(label)) {
        kind = RelationKind.BROADER;
      } else if (settings.narrowerLabels().contains(label)) {
        kind = RelationKind.NARROWER;
      } else {
        discarded++;
        continue;
      }
      String related = relatedConceptId(item.path("relatedId").asText(""));
      if (related == null || related.equals(conceptId)) {
        discarded++;
        continue;
      }
      out.add(new ConceptRelation(conceptId, related, kind));
    }
    log.debug(
        "UMLS relations for {}: {} hierarchy relations, {} discarded",
        conceptId,
        out.size(),
        discarded);
    return out;
  }

  private List<String> definitions(String conceptId) {
    Optional<JsonNode> response =
        fetch(conceptUrl(conceptId, "definitions"), "definitions", conceptId);
    if (response.isEmpty()) return List.of();
    List<String> values = new ArrayList<>();
    for (JsonNode def : response.get().path("result")) {
      String value = def.path("value").asText("");
      if (!value.isBlank()) values.add(value);
    }
    return values;
  }

  /**
   * Extract the concept id from a {@code relatedId} URL. Only ids that address a CUI are returned,
   * relations pointing at atoms or source concepts are not concept hierarchy links.
   */
  static String relatedConceptId(String relatedId) {
    if (relatedId == null || relatedId.isBlank()) return null;
    HttpUrl url = HttpUrl.parse(relatedId);
    List<String> segments =
        url != null ? url.pathSegments() : List.of(relatedId.replaceAll("/+$", "").split("/"));
    int size = segments.size();
    if (size < 2 || !"CUI".equals(segments.get(size - 2))) return null;
    String id = segments.get(size - 1);
    return id.isBlank() ? null : id;
  }

  private HttpUrl conceptUrl(String conceptId, String child) {
    HttpUrl.Builder b =
        baseUrl.newBuilder().addPathSegments("content/current/CUI").addPathSegment(conceptId);
    if (child != null) b.addPathSegment(child);
    return b.addQueryParameter("apiKey", settings.apiKey()).build();
  }

  /**
   * Execute one GET. 401 raises {@link AuthenticationException}; 404 and every transient failure
   * return empty.
   */
  private Optional<JsonNode> fetch(HttpUrl url, String what, String conceptId) {
    Request request = new Request.Builder().url(url).get().build();
    try (Response response = http.newCall(request).execute()) {
      int code = response.code();
      if (code == 401) {
        throw new AuthenticationException(
            "UMLS rejected the configured API key",
            Map.of("conceptId", conceptId, "endpoint", what));
      }
      if (code == 404) {
        log.debug("UMLS {} not found for {}", what, conceptId);
        return Optional.empty();
      }
      if (!response.isSuccessful()) {
        throw new NetworkException(
            "UMLS %s request for %s failed with HTTP %d".formatted(what, conceptId, code));
      }
      ResponseBody body = response.body();
      if (body == null) {
        throw new NetworkException(
            "UMLS %s response for %s has no body".formatted(what, conceptId));
      }
      return Optional.of(JacksonUtility.getJsonMapper().readTree(body.string()));
    } catch (NetworkException e) {
      log.warn("{}; treating as absent", e.getMessage());
      return Optional.empty();
    } catch (IOException e) {
      log.warn(
          "UMLS {} request for {} failed ({}): {}; treating as absent",
          what,
          conceptId,
          LoggingInterceptor.redact(url),
          e.toString());
      return Optional.empty();
    }
  }

  private boolean available() {
    if (isAvailable()) return true;
    if (missingKeyReported.compareAndSet(false, true)) {
      log.warn("umls.apiKey not configured, concept details unavailable (capability degraded)");
    }
    return false;
  }
}
