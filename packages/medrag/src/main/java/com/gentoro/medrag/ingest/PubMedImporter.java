package com.gentoro.medrag.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.medrag.config.MedRagSettings.ImportSettings;
import com.gentoro.medrag.exception.GraphConnectionClosedException;
import com.gentoro.medrag.exception.IoException;
import com.gentoro.medrag.exception.NotFoundException;
import com.gentoro.medrag.exception.SerializationException;
import com.gentoro.medrag.exception.ValidationException;
import com.gentoro.medrag.graph.GraphStore;
import com.gentoro.medrag.utility.JacksonUtility;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Bulk import of a PubMed corpus into document nodes.
 *
 * <p>The corpus is one JSON object keyed by paper id; each paper carries {@code paper_title},
 * {@code paper_authors}, {@code paper_journal}, {@code paper_year}, {@code paper_abstract} and
 * {@code paper_full_text}. One document node is created per paper.
 */
public class PubMedImporter {
  private static final org.slf4j.Logger log =
      com.gentoro.medrag.logging.LoggingService.getLogger(PubMedImporter.class);

  static final String UNKNOWN_JOURNAL = "Unknown Journal";
  static final String UNKNOWN_YEAR = "Unknown Year";

  private final GraphStore graph;
  private final ImportSettings settings;
  private final Clock clock;

  public PubMedImporter(GraphStore graph, ImportSettings settings) {
    this(graph, settings, Clock.systemUTC());
  }

  PubMedImporter(GraphStore graph, ImportSettings settings, Clock clock) {
    this.graph = graph;
    this.settings = settings;
    this.clock = clock;
  }

  /**
   * @param clearFirst remove every node and edge before importing
   * @throws NotFoundException when the corpus file does not exist
   */
  public ImportReport importFromJson(Path path, boolean clearFirst) {
    log.info("Starting PubMed import from {}", path);
    if (!Files.exists(path)) {
      throw new NotFoundException("PubMed corpus not found: " + path);
    }

    JsonNode corpus;
    try (InputStream in = Files.newInputStream(path)) {
      corpus = JacksonUtility.getJsonMapper().readTree(in);
    } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
      throw new SerializationException("PubMed corpus is not valid JSON: " + path, e);
    } catch (IOException e) {
      throw new IoException("Failed to read PubMed corpus " + path, e);
    }
    if (corpus == null || !corpus.isObject()) {
      throw new SerializationException("PubMed corpus must be a JSON object keyed by paper id");
    }

    if (clearFirst) {
      graph.clearAll();
    }

    int total = corpus.size();
    log.info("Found {} papers to process", total);
    int imported = 0;
    List<String> failed = new ArrayList<>();
    Iterator<Map.Entry<String, JsonNode>> it = corpus.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> paper = it.next();
      try {
        importPaper(paper.getKey(), paper.getValue());
        imported++;
      } catch (GraphConnectionClosedException e) {
        throw e;
      } catch (RuntimeException e) {
        log.error("Error importing paper {}: {}", paper.getKey(), e.getMessage(), e);
        failed.add(paper.getKey());
      }
      int done = imported + failed.size();
      if (done % 100 == 0) {
        log.info("Imported {}/{} papers", done, total);
      }
    }

    log.info("Import complete: {} successful, {} errors", imported, failed.size());
    return new ImportReport(total, imported, failed.size(), failed);
  }

  String importPaper(String paperId, JsonNode paper) {
    if (paper == null || !paper.isObject()) {
      throw new ValidationException("Paper %s is not a JSON object".formatted(paperId));
    }
    String title = text(paper, "paper_title");
    String content = buildBaseContent(paper) + processFullText(text(paper, "paper_full_text"));
    return graph.upsertDocument(
        title.isEmpty() ? paperId : title, content, sourceDescription(paper), referenceTime(paper));
  }

  static String buildBaseContent(JsonNode paper) {
    return "Title: "
        + text(paper, "paper_title")
        + "\nAuthors: "
        + text(paper, "paper_authors")
        + "\nJournal: "
        + text(paper, "paper_journal")
        + "\nYear: "
        + text(paper, "paper_year")
        + "\nAbstract: "
        + text(paper, "paper_abstract")
        + "\n\n";
  }

  String processFullText(String fullText) {
    if (fullText.length() < settings.minTextLength()) return "";
    return fullText.length() <= settings.maxTextLength()
        ? fullText
        : fullText.substring(0, settings.maxTextLength());
  }

  static String sourceDescription(JsonNode paper) {
    String journal = paper.has("paper_journal") ? text(paper, "paper_journal") : UNKNOWN_JOURNAL;
    String year = paper.has("paper_year") ? text(paper, "paper_year") : UNKNOWN_YEAR;
    return journal + ", " + year;
  }

  /** January 1st of the paper year in UTC, or now when the year is missing or not a number. */
  Instant referenceTime(JsonNode paper) {
    String year = text(paper, "paper_year").trim();
    try {
      return LocalDate.of(Integer.parseInt(year), 1, 1).atStartOfDay(ZoneOffset.UTC).toInstant();
    } catch (NumberFormatException | java.time.DateTimeException e) {
      log.debug("Unusable paper_year '{}', using current time", year);
      return clock.instant();
    }
  }

  /** Field value as text; arrays are joined with ", ", null and missing become "". */
  static String text(JsonNode paper, String field) {
    JsonNode v = paper.get(field);
    if (v == null || v.isNull()) return "";
    if (v.isArray()) {
      List<String> parts = new ArrayList<>();
      for (JsonNode item : v) parts.add(item.asText());
      return String.join(", ", parts);
    }
    return v.asText();
  }
}
