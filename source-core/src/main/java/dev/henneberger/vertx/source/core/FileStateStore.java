package dev.henneberger.vertx.source.core;

import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * Stores state blobs as fields of one JSON file. Writes go to a sibling temp file that is then
 * moved over the target, so a crash leaves either the old or the new content.
 */
public final class FileStateStore implements StateStore {

  private final Path file;
  private final Object monitor = new Object();

  public FileStateStore(Path file) {
    this.file = Objects.requireNonNull(file, "file");
  }

  @Override
  public Optional<String> load(String key) throws Exception {
    Objects.requireNonNull(key, "key");
    synchronized (monitor) {
      JsonObject entry = readAll().getJsonObject(key);
      return Optional.ofNullable(entry).map(JsonObject::encode);
    }
  }

  @Override
  public void save(String key, String state) throws Exception {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(state, "state");

    synchronized (monitor) {
      JsonObject values = readAll();
      values.put(key, new JsonObject(state));
      writeAll(values);
    }
  }

  private JsonObject readAll() throws IOException {
    if (Files.notExists(file)) {
      return new JsonObject();
    }

    String raw = Files.readString(file, StandardCharsets.UTF_8);
    if (raw.isBlank()) {
      return new JsonObject();
    }
    try {
      return new JsonObject(raw);
    } catch (DecodeException e) {
      throw new StateCorruptException("State file " + file + " is not valid JSON", e);
    }
  }

  private void writeAll(JsonObject values) throws IOException {
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }

    Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
    Files.writeString(temp, values.encodePrettily(), StandardCharsets.UTF_8);
    try {
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
