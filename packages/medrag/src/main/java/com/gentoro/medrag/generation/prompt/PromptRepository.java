package com.gentoro.medrag.generation.prompt;

/** Source of named prompt templates. */
public interface PromptRepository {
  /**
   * @throws com.gentoro.medrag.exception.NotFoundException when no template has that name
   * @throws com.gentoro.medrag.exception.PromptException when the template cannot be parsed
   */
  PromptTemplate get(String name);
}
