package com.mnemo.core.textgen;

/**
 * Boundary to a language model used for summarisation and fact extraction.
 * Implementations may return null or throw; callers treat both as "nothing generated".
 */
@FunctionalInterface
public interface TextGenerator {
    String generate(String prompt, int maxTokens);
}
