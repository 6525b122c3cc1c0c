package com.codeheadsystems.guardian.core.store;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileRunStateStoreTest {

  @TempDir Path tempDir;

  @Test
  void load_missingFile_isEmpty() {
    assertThat(new FileRunStateStore(tempDir.resolve("state")).load()).isEmpty();
  }

  @Test
  void save_thenLoad_returnsLastState() throws Exception {
    Path path = tempDir.resolve("nested/run.state");
    FileRunStateStore store = new FileRunStateStore(path);

    store.save("DISCOVERING");
    store.save("EXTRACTING");

    assertThat(store.load()).contains("EXTRACTING");
    assertThat(Files.readString(path)).isEqualTo("EXTRACTING");
    assertThat(path.resolveSibling("run.state.tmp")).doesNotExist();
  }

  @Test
  void inMemory_keepsHistory() {
    InMemoryRunStateStore store = new InMemoryRunStateStore();

    store.save("IDLE");
    store.save("DISCOVERING");

    assertThat(store.history()).containsExactly("IDLE", "DISCOVERING");
    assertThat(store.load()).contains("DISCOVERING");
  }
}
