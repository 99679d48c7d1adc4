package com.gentoro.medrag.generation.prompt.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.medrag.exception.ExceptionUtil;
import com.gentoro.medrag.exception.NotFoundException;
import com.gentoro.medrag.exception.PromptException;
import com.gentoro.medrag.exception.ValidationException;
import com.gentoro.medrag.generation.LlmClient;
import com.gentoro.medrag.generation.prompt.PromptRepository;
import com.gentoro.medrag.generation.prompt.PromptTemplate;
import com.gentoro.medrag.utility.JacksonUtility;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Loads prompt YAML templates from the classpath starting at a base directory. Example basePath:
 * "prompts" (will resolve resources like "prompts/medical-answer.yaml").
 *
 * <p>Expected layout:
 *
 * <pre>
 * sections:
 *   - role: system | user | assistant
 *     id: section-id
 *     enabled: true
 *     content: |
 *       Pebble template text
 * </pre>
 */
public class ClasspathPromptRepository implements PromptRepository {
  private final String basePath;
  private final ClassLoader classLoader;

  public ClasspathPromptRepository(String basePath) {
    this(basePath, Thread.currentThread().getContextClassLoader());
  }

  public ClasspathPromptRepository(String basePath, ClassLoader classLoader) {
    this.basePath = normalize(Objects.requireNonNull(basePath, "basePath"));
    this.classLoader =
        Objects.requireNonNullElseGet(
            classLoader, () -> ClasspathPromptRepository.class.getClassLoader());
  }

  @Override
  public PromptTemplate get(String name) {
    try {
      String id = (name.charAt(0) == '/' ? name.substring(1) : name);

      String resource = resolveExisting(id);
      if (resource == null) {
        throw new NotFoundException("Prompt not found on classpath: " + name);
      }

      String yamlContent;
      try (InputStream is = classLoader.getResourceAsStream(resource)) {
        if (is == null) {
          throw new NotFoundException("Prompt resource not found: " + resource);
        }
        yamlContent = new String(is.readAllBytes(), StandardCharsets.UTF_8);
      }

      JsonNode arr = JacksonUtility.getYamlMapper().readTree(yamlContent).get("sections");
      if (arr == null || !arr.isArray()) {
        throw new ValidationException("Prompt YAML must contain a 'sections' array: " + id);
      }

      List<PromptTemplate.PromptSection> sections = new ArrayList<>();
      for (JsonNode n : arr) {
        String roleStr = n.path("role").asText(null);
        if (roleStr == null) {
          throw new ValidationException("Missing role for a section in prompt: " + id);
        }
        LlmClient.Role role =
            switch (roleStr.toLowerCase()) {
              case "user" -> LlmClient.Role.USER;
              case "assistant" -> LlmClient.Role.ASSISTANT;
              case "system" -> LlmClient.Role.SYSTEM;
              default -> throw new ValidationException(
                  "Unknown role '" + roleStr + "' in prompt: " + id);
            };

        String sectionId = n.path("id").asText(null);
        if (sectionId == null || sectionId.isBlank()) {
          throw new ValidationException("Missing section id in prompt: " + id);
        }
        String content = n.path("content").asText("");
        if (content.isBlank()) {
          throw new ValidationException(
              "Empty content for section '" + sectionId + "' in prompt: " + id);
        }
        sections.add(
            new PromptTemplate.PromptSection(
                role, sectionId, n.path("enabled").asBoolean(false), content));
      }

      return new PebblePromptTemplate(id, sections);
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e, (ex) -> new PromptException("Failed to read prompt file: " + name, ex));
    }
  }

  private String resolveExisting(String id) {
    String yaml = basePath + "/" + id + ".yaml";
    if (classLoader.getResource(yaml) != null) return yaml;
    String yml = basePath + "/" + id + ".yml";
    if (classLoader.getResource(yml) != null) return yml;
    return null;
  }

  private static String normalize(String p) {
    String out = p.trim();
    if (out.startsWith("/")) out = out.substring(1);
    if (out.endsWith("/")) out = out.substring(0, out.length() - 1);
    return out;
  }
}
