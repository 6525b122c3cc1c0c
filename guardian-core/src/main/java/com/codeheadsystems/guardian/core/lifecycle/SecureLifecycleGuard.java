package com.codeheadsystems.guardian.core.lifecycle;

import com.codeheadsystems.guardian.common.RandomProvider;
import com.codeheadsystems.guardian.common.Wipeable;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scoped owner of every sensitive value created during one run.
 * <p>
 * Values are registered with {@link #track}; {@link #release} randomizes and then zero-fills a
 * value's backing storage and drops it from tracking. {@link #releaseAll()} (also reached through
 * {@link #close()}) does that for every tracked value and then asks the runtime for a collection
 * and sweeps leftover temporary files matching {@link #DEFAULT_TEMP_FILE_PATTERN}. The last two
 * steps are advisory and never throw.
 * <p>
 * One guard belongs to one run. Sharing a guard across runs would let one run's
 * {@code releaseAll} race another run's live values.
 */
public class SecureLifecycleGuard implements AutoCloseable {

  /** Glob for temporary files written by browser tooling. */
  public static final String DEFAULT_TEMP_FILE_PATTERN = "cookie_*";

  private static final Logger log = LoggerFactory.getLogger(SecureLifecycleGuard.class);

  private final RandomProvider randomProvider;
  private final Path tempDirectory;
  private final String tempFilePattern;
  private final AtomicLong sequence = new AtomicLong();
  private final Map<GuardHandle, Wipeable> tracked = new ConcurrentHashMap<>();

  /**
   * Guard over the JVM temp directory with the default file pattern.
   */
  public SecureLifecycleGuard() {
    this(new RandomProvider(), Paths.get(System.getProperty("java.io.tmpdir")), DEFAULT_TEMP_FILE_PATTERN);
  }

  /**
   * Instantiates a new Secure lifecycle guard.
   *
   * @param randomProvider  source for the randomize pass
   * @param tempDirectory   directory swept by {@link #releaseAll()}
   * @param tempFilePattern glob of files to remove from {@code tempDirectory}
   */
  public SecureLifecycleGuard(final RandomProvider randomProvider,
                              final Path tempDirectory,
                              final String tempFilePattern) {
    this.randomProvider = randomProvider;
    this.tempDirectory = tempDirectory;
    this.tempFilePattern = tempFilePattern;
  }

  /**
   * Registers a sensitive value for eventual release.
   *
   * @param value the value holder
   * @param label non-sensitive label for logs
   * @return the handle
   */
  public GuardHandle track(final Wipeable value, final String label) {
    if (value == null) {
      throw new IllegalArgumentException("Cannot track a null value");
    }
    GuardHandle handle = new GuardHandle(sequence.incrementAndGet(), label);
    tracked.put(handle, value);
    log.trace("track({})", handle);
    return handle;
  }

  /**
   * Scrubs the value behind the handle and stops tracking it. Unknown or already released
   * handles are ignored.
   *
   * @param handle the handle
   */
  public void release(final GuardHandle handle) {
    scrub(handle);
  }

  /**
   * Releases every tracked value, then requests a collection and sweeps temporary files.
   *
   * @return the number of values released
   */
  public int releaseAll() {
    int released = 0;
    for (GuardHandle handle : tracked()) {
      if (scrub(handle)) {
        released++;
      }
    }
    log.debug("releaseAll(): released={}", released);
    requestCollection();
    sweepTempFiles();
    return released;
  }

  /**
   * Snapshot of the handles still tracked, oldest first.
   *
   * @return the set
   */
  public Set<GuardHandle> tracked() {
    Set<GuardHandle> snapshot = new LinkedHashSet<>();
    tracked.keySet().stream()
        .sorted(Comparator.comparingLong(GuardHandle::id))
        .forEach(snapshot::add);
    return snapshot;
  }

  /**
   * Whether the handle is still tracked.
   *
   * @param handle the handle
   * @return the boolean
   */
  public boolean isTracked(final GuardHandle handle) {
    return tracked.containsKey(handle);
  }

  /**
   * Removes files in the temp directory matching the pattern. Failures are logged and skipped.
   *
   * @return the number of files removed
   */
  public int sweepTempFiles() {
    if (tempDirectory == null || !Files.isDirectory(tempDirectory)) {
      return 0;
    }
    int removed = 0;
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(tempDirectory, tempFilePattern)) {
      for (Path path : stream) {
        try {
          if (Files.isRegularFile(path) && Files.deleteIfExists(path)) {
            removed++;
          }
        } catch (IOException | SecurityException e) {
          log.debug("Could not remove temp file {}: {}", path.getFileName(), e.toString());
        }
      }
    } catch (IOException | RuntimeException e) {
      log.warn("Temp file sweep of {} failed: {}", tempDirectory, e.toString());
    }
    if (removed > 0) {
      log.debug("sweepTempFiles(): removed={}", removed);
    }
    return removed;
  }

  @Override
  public void close() {
    releaseAll();
  }

  private boolean scrub(final GuardHandle handle) {
    Wipeable value = tracked.remove(handle);
    if (value == null) {
      return false;
    }
    value.wipe(randomProvider);
    log.trace("release({})", handle);
    return true;
  }

  private void requestCollection() {
    try {
      System.gc();
    } catch (RuntimeException e) {
      log.debug("Collection request rejected: {}", e.toString());
    }
  }
}
