package io.intellixity.polyquery.controller;

/** Raw text source for plans, e.g. a chat-completion call returning plan JSON. */
@FunctionalInterface
public interface PlanTextGenerator {
  String generate(String requestText, String feedback);
}
