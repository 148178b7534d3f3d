package io.docanalytics.worker;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Generates readable instance ids for workers started without one.
 */
public final class WorkerNameGenerator {

  private static final List<String> ADJECTIVES =
      List.of("quiet", "brisk", "steady", "curious", "patient", "nimble", "tidy", "keen", "sober", "eager");

  private static final List<String> NOUNS =
      List.of("reader", "scribe", "clerk", "indexer", "parser", "archivist", "scanner", "librarian");

  private WorkerNameGenerator() {}

  public static String generate() {
    String id = UUID.randomUUID().toString().substring(0, 4);
    return String.format("worker-%s-%s-%s", randomFrom(ADJECTIVES), randomFrom(NOUNS), id);
  }

  private static String randomFrom(List<String> options) {
    return options.get(ThreadLocalRandom.current().nextInt(options.size()));
  }
}
