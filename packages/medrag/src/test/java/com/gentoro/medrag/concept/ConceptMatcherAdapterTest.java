package com.gentoro.medrag.concept;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ConceptMatcherAdapterTest {

  @Mock private ConceptMatcher matcher;

  @Test
  @DisplayName("Overlapping candidates keep the highest similarity, then the lowest concept id")
  void keepsBestCandidatePerSpan() {
    // Arrange
    when(matcher.isAvailable()).thenReturn(true);
    when(matcher.candidates(anyString()))
        .thenReturn(
            List.of(
                new CandidateMatch(0, 8, "diabetes", "diabetes", "C0011860", 0.9),
                new CandidateMatch(0, 8, "diabetes", "diabetes mellitus", "C0011849", 0.9),
                new CandidateMatch(0, 8, "diabetes", "diabete", "C0000001", 0.85),
                new CandidateMatch(13, 25, "hypertension", "hypertension", "C0020538", 1.0)));
    ConceptMatcherAdapter adapter = new ConceptMatcherAdapter(matcher, 0.8);

    // Act
    List<Mention> mentions = adapter.match("diabetes and hypertension");

    // Assert
    assertEquals(2, mentions.size());
    assertEquals("C0011849", mentions.get(0).conceptId());
    assertEquals("C0020538", mentions.get(1).conceptId());
    assertEquals("hypertension", mentions.get(1).surfaceForm());
  }

  @Test
  @DisplayName("Equal similarity prefers the longer surface form")
  void prefersLongerSpanOnEqualSimilarity() {
    when(matcher.isAvailable()).thenReturn(true);
    when(matcher.candidates(anyString()))
        .thenReturn(
            List.of(
                new CandidateMatch(0, 5, "heart", "heart", "C0018787", 0.9),
                new CandidateMatch(0, 13, "heart failure", "heart failure", "C0018801", 0.9)));

    List<Mention> mentions = new ConceptMatcherAdapter(matcher, 0.8).match("heart failure");

    assertEquals(1, mentions.size());
    assertEquals("C0018801", mentions.get(0).conceptId());
  }

  @Test
  @DisplayName("A weaker span bridging two better matches does not suppress either of them")
  void weakerBridgingSpanKeepsBothBetterMatches() {
    // Arrange
    when(matcher.isAvailable()).thenReturn(true);
    when(matcher.candidates(anyString()))
        .thenReturn(
            List.of(
                new CandidateMatch(0, 13, "heart failure", "heart failure", "C0018801", 0.85),
                new CandidateMatch(0, 5, "heart", "heart", "C0018787", 1.0),
                new CandidateMatch(6, 13, "failure", "failure", "C0231174", 1.0)));

    // Act
    List<Mention> mentions = new ConceptMatcherAdapter(matcher, 0.8).match("heart failure");

    // Assert
    assertEquals(2, mentions.size());
    assertEquals("C0018787", mentions.get(0).conceptId());
    assertEquals(0, mentions.get(0).start());
    assertEquals("C0231174", mentions.get(1).conceptId());
    assertEquals(6, mentions.get(1).start());
  }

  @Test
  void dropsCandidatesBelowThreshold() {
    when(matcher.isAvailable()).thenReturn(true);
    when(matcher.candidates(anyString()))
        .thenReturn(List.of(new CandidateMatch(0, 6, "fevers", "fever", "C0015967", 0.79)));

    assertTrue(new ConceptMatcherAdapter(matcher, 0.8).match("fevers").isEmpty());
  }

  @Test
  void unavailableMatcherYieldsNoMentions() {
    when(matcher.isAvailable()).thenReturn(false);

    assertTrue(new ConceptMatcherAdapter(matcher, 0.8).match("aspirin").isEmpty());
    verify(matcher, never()).candidates(anyString());
  }

  @Test
  void failingMatcherYieldsNoMentions() {
    when(matcher.isAvailable()).thenReturn(true);
    when(matcher.candidates(anyString())).thenThrow(new IllegalStateException("index corrupt"));

    assertTrue(new ConceptMatcherAdapter(matcher, 0.8).match("aspirin").isEmpty());
  }

  @Test
  void blankTextNeverReachesMatcher() {
    ConceptMatcherAdapter adapter = new ConceptMatcherAdapter(matcher, 0.8);

    assertTrue(adapter.match("  ").isEmpty());
    assertTrue(adapter.match(null).isEmpty());
    verifyNoInteractions(matcher);
  }
}
