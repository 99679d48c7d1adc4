package com.gentoro.medrag.generation.prompt.impl;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.medrag.exception.NotFoundException;
import com.gentoro.medrag.exception.PromptException;
import com.gentoro.medrag.exception.ValidationException;
import com.gentoro.medrag.generation.LlmClient;
import com.gentoro.medrag.generation.prompt.PromptTemplate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ClasspathPromptRepositoryTest {

  private final ClasspathPromptRepository repository = new ClasspathPromptRepository("/prompts/");

  @Test
  void loadsAnswerTemplateWithPersonaEnabledByDefault() {
    // Act
    PromptTemplate template = repository.get("medical-answer");
    List<LlmClient.Message> defaults = template.newSession().renderMessages();

    // Assert
    assertEquals("medical-answer", template.id());
    assertEquals(2, template.sections().size());
    assertEquals(1, defaults.size());
    assertEquals(LlmClient.Role.SYSTEM, defaults.get(0).role());
    assertEquals("You are a helpful biomedical expert assistant.", defaults.get(0).content());
  }

  @Test
  void questionSectionRendersQueryAndContextVerbatim() {
    PromptTemplate template = repository.get("medical-answer");

    Map<String, Object> vars = Map.of("query", "Is <MRSA> resistant?", "context", "1. fact & more");

    List<LlmClient.Message> messages =
        template.newSession().enable("question", vars).renderMessages();

    assertEquals(2, messages.size());
    LlmClient.Message user = messages.get(1);
    assertEquals(LlmClient.Role.USER, user.role());
    assertTrue(user.content().contains("User Question:\nIs <MRSA> resistant?"));
    assertTrue(user.content().contains("1. fact & more"));
    assertTrue(user.content().endsWith("Answer:"));
  }

  @Test
  void missingVariableFailsRendering() {
    PromptTemplate template = repository.get("medical-answer");

    PromptTemplate.PromptSession session =
        template.newSession().enable("question", Map.of("query", "only the query"));

    assertThrows(PromptException.class, session::renderMessages);
  }

  @Test
  void unknownSectionIsRejected() {
    PromptTemplate template = repository.get("medical-answer");

    assertThrows(PromptException.class, () -> template.newSession().enable("nope", Map.of()));
  }

  @Test
  void missingTemplateIsNotFound() {
    assertThrows(NotFoundException.class, () -> repository.get("does-not-exist"));
  }

  @Test
  void unknownRoleIsRejected() {
    assertThrows(ValidationException.class, () -> repository.get("test-broken"));
  }
}
