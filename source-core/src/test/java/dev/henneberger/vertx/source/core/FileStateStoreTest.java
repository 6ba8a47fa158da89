package dev.henneberger.vertx.source.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vertx.core.json.JsonObject;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileStateStoreTest {

  @TempDir
  Path dir;

  @Test
  void keepsEntriesPerKey() throws Exception {
    FileStateStore store = new FileStateStore(dir.resolve("state/sync.json"));
    store.save("a", "{\"streams\":{}}");
    store.save("b", "{\"streams\":{\"public.t\":{\"cursor\":3}}}");

    FileStateStore reopened = new FileStateStore(dir.resolve("state/sync.json"));
    assertEquals(new JsonObject("{\"streams\":{}}"), new JsonObject(reopened.load("a").orElseThrow()));
    assertEquals(3, new JsonObject(reopened.load("b").orElseThrow())
      .getJsonObject("streams").getJsonObject("public.t").getInteger("cursor"));
    assertTrue(reopened.load("missing").isEmpty());
  }

  @Test
  void unreadableFileIsCorrupt() throws Exception {
    Path file = dir.resolve("broken.json");
    Files.writeString(file, "{oops", StandardCharsets.UTF_8);

    assertThrows(StateCorruptException.class, () -> new FileStateStore(file).load("a"));
  }
}
