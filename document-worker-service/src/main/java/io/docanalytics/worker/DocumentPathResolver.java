package io.docanalytics.worker;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a work item into a readable file: the item as given when it exists, otherwise a file of
 * the same name under the documents root.
 */
public class DocumentPathResolver {

  private static final Logger log = LoggerFactory.getLogger(DocumentPathResolver.class);

  private final Path documentsRoot;

  public DocumentPathResolver(Path documentsRoot) {
    this.documentsRoot = Objects.requireNonNull(documentsRoot, "documentsRoot");
  }

  public Optional<Path> resolve(String item) {
    if (item == null || item.isBlank()) {
      return Optional.empty();
    }
    Path given;
    try {
      given = Path.of(item);
    } catch (InvalidPathException e) {
      log.warn("[WORKER] unusable document path {}: {}", item, e.getMessage());
      return Optional.empty();
    }
    if (Files.isRegularFile(given)) {
      return Optional.of(given);
    }
    Path fileName = given.getFileName();
    if (fileName == null) {
      return Optional.empty();
    }
    Path fallback = documentsRoot.resolve(fileName.toString());
    if (Files.isRegularFile(fallback)) {
      log.debug("[WORKER] {} resolved under documents root as {}", item, fallback);
      return Optional.of(fallback);
    }
    return Optional.empty();
  }
}
