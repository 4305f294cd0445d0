package io.intellixity.polyquery.examples;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.intellixity.polyquery.controller.QueryAnswer;
import io.intellixity.polyquery.controller.QueryController;
import io.intellixity.polyquery.controller.QueryPipelineException;
import io.intellixity.polyquery.controller.QueryRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;

/**
 * Command-line entry: {@code <question words...> [--human-readable] [--merge-keys=id,title]}.\n
 *
 * Prints the summary when requested, otherwise the rows as JSON.
 */
@Component
public class QueryCommandRunner implements ApplicationRunner {
  private static final Logger log = LoggerFactory.getLogger(QueryCommandRunner.class);
  private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  private final QueryController controller;
  private final PrintStream out;

  public QueryCommandRunner(QueryController controller) {
    this(controller, System.out);
  }

  QueryCommandRunner(QueryController controller, PrintStream out) {
    this.controller = controller;
    this.out = out;
  }

  @Override
  public void run(ApplicationArguments args) throws Exception {
    if (args.getNonOptionArgs().isEmpty()) {
      log.info("polyquery.cli no question given; nothing to do");
      return;
    }
    QueryRequest request = new QueryRequest(
        String.join(" ", args.getNonOptionArgs()),
        args.containsOption("human-readable"),
        mergeKeys(args));
    try {
      QueryAnswer answer = controller.answer(request);
      if (answer.summary() != null) out.println(answer.summary());
      else out.println(JSON.writeValueAsString(answer.rows()));
    } catch (QueryPipelineException e) {
      log.error("polyquery.cli attempts={} kind={} error={}", e.attempts(), e.lastFailureKind(), e.lastFailure().message());
      throw e;
    }
  }

  static List<String> mergeKeys(ApplicationArguments args) {
    List<String> values = args.getOptionValues("merge-keys");
    if (values == null) return List.of();
    return values.stream()
        .flatMap(v -> Arrays.stream(v.split(",")))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .toList();
  }
}
