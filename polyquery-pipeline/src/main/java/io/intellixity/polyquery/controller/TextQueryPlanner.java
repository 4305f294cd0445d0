package io.intellixity.polyquery.controller;

import io.intellixity.polyquery.plan.PlanAcquisitionException;
import io.intellixity.polyquery.plan.PlanJson;
import io.intellixity.polyquery.plan.QueryPlan;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link QueryPlanner} over a {@link PlanTextGenerator}: parses the generated text as plan JSON.\n
 *
 * A single surrounding markdown code fence (```json ... ```) is stripped first.
 */
public final class TextQueryPlanner implements QueryPlanner {
  private static final Pattern FENCE = Pattern.compile("^\\s*```[a-zA-Z]*\\s*\\n(.*?)\\n?\\s*```\\s*$", Pattern.DOTALL);

  private final PlanTextGenerator generator;

  public TextQueryPlanner(PlanTextGenerator generator) {
    this.generator = Objects.requireNonNull(generator, "generator");
  }

  @Override
  public QueryPlan plan(String requestText, String feedback) {
    String raw;
    try {
      raw = generator.generate(requestText, feedback);
    } catch (PlanAcquisitionException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new PlanAcquisitionException("Plan generation failed: " + e.getMessage(), e);
    }
    if (raw == null || raw.isBlank()) throw new PlanAcquisitionException("Plan generator returned no text");
    return PlanJson.read(stripFence(raw));
  }

  static String stripFence(String raw) {
    Matcher m = FENCE.matcher(raw);
    return m.matches() ? m.group(1) : raw;
  }
}
