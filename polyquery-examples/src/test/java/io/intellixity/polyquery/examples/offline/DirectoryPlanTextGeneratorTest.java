package io.intellixity.polyquery.examples.offline;

import io.intellixity.polyquery.plan.PlanAcquisitionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

final class DirectoryPlanTextGeneratorTest {

  @Test
  void slugIsLowerCaseDashed() {
    assertEquals("movies-with-al-pacino", DirectoryPlanTextGenerator.slug("Movies with  Al Pacino?"));
    assertEquals("top-10", DirectoryPlanTextGenerator.slug("  Top 10!!"));
    assertThrows(PlanAcquisitionException.class, () -> DirectoryPlanTextGenerator.slug("???"));
  }

  @Test
  void readsPlanFileForRequest(@TempDir Path dir) throws Exception {
    Files.writeString(dir.resolve("top-10.json"), "{\"pipeline\":[]}");
    assertEquals("{\"pipeline\":[]}", new DirectoryPlanTextGenerator(dir).generate("Top 10", null));
  }

  @Test
  void missingFileIsPlanAcquisitionFailure(@TempDir Path dir) {
    PlanAcquisitionException e = assertThrows(PlanAcquisitionException.class,
        () -> new DirectoryPlanTextGenerator(dir).generate("unknown question", "feedback"));
    assertEquals("No plan file for request: unknown-question.json", e.getMessage());
  }
}
