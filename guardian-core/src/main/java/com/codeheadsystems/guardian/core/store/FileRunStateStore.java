package com.codeheadsystems.guardian.core.store;

import com.codeheadsystems.guardian.core.collaborator.RunStateStore;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the current state name in a single text file, replaced atomically on every save so an
 * observer never reads a partial value.
 */
public class FileRunStateStore implements RunStateStore {

  private static final Logger log = LoggerFactory.getLogger(FileRunStateStore.class);

  private final Path path;

  public FileRunStateStore(final Path path) {
    log.info("FileRunStateStore({})", path);
    this.path = path;
  }

  @Override
  public void save(final String state) {
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
      Files.writeString(tmp, state, StandardCharsets.UTF_8);
      Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      throw new UncheckedIOException("Could not persist run state to " + path, e);
    }
  }

  @Override
  public Optional<String> load() {
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try {
      String state = Files.readString(path, StandardCharsets.UTF_8).trim();
      return state.isEmpty() ? Optional.empty() : Optional.of(state);
    } catch (IOException e) {
      throw new UncheckedIOException("Could not read run state from " + path, e);
    }
  }
}
