package io.intellixity.polyquery.examples.offline;

import io.intellixity.polyquery.controller.PlanTextGenerator;
import io.intellixity.polyquery.plan.PlanAcquisitionException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Serves hand-written plan JSON from a directory, one file per request.\n
 *
 * The file name is the request slug: lower-cased, runs of non-alphanumerics replaced by {@code -},
 * e.g. {@code "Movies with Al Pacino?"} -> {@code movies-with-al-pacino.json}. Feedback is ignored.
 */
public final class DirectoryPlanTextGenerator implements PlanTextGenerator {
  private final Path dir;

  public DirectoryPlanTextGenerator(Path dir) {
    this.dir = Objects.requireNonNull(dir, "dir");
  }

  @Override
  public String generate(String requestText, String feedback) {
    Path file = dir.resolve(slug(requestText) + ".json");
    if (!Files.isRegularFile(file)) {
      throw new PlanAcquisitionException("No plan file for request: " + file.getFileName());
    }
    try {
      return Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new PlanAcquisitionException("Failed to read plan file " + file + ": " + e.getMessage(), e);
    }
  }

  static String slug(String text) {
    String s = text.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
    s = s.replaceAll("^-+|-+$", "");
    if (s.isEmpty()) throw new PlanAcquisitionException("Request has no usable characters for a plan name");
    return s;
  }
}
