package dev.henneberger.vertx.source.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vertx.core.json.JsonObject;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class StateManagerTest {

  private static final StreamDescriptor ORDERS = StreamDescriptor.of("public", "orders");
  private static final StreamDescriptor USERS = StreamDescriptor.of("public", "users");

  @Test
  void rejectsCursorRegression() {
    StateManager manager = new StateManager();
    assertTrue(manager.checkpoint(ORDERS, CursorState.cursor("updated_at", "2020-01-05")));

    assertFalse(manager.checkpoint(ORDERS, CursorState.cursor("updated_at", "2020-01-01")));
    assertEquals("2020-01-05", manager.get(ORDERS).cursorValue());
    assertEquals(1, manager.regressions());
  }

  @Test
  void rejectsLogPositionRegression() {
    StateManager manager = new StateManager();
    manager.checkpointLog(LogPosition.parse("1/0"));

    assertFalse(manager.checkpointLog(LogPosition.parse("0/FFFF")));
    assertEquals(Optional.of(LogPosition.parse("1/0")), manager.current().confirmedLogPosition());
  }

  @Test
  void flushWritesToStoreAndLoadsBack() throws Exception {
    InMemoryStateStore store = new InMemoryStateStore();
    StateManager manager = new StateManager(store, "sync-a");
    manager.checkpoint(USERS, CursorState.log(LogPosition.parse("0/16B3748")));
    manager.checkpointLog(LogPosition.parse("0/16B3748"));
    SyncState flushed = manager.flush();

    StateManager restored = new StateManager(store, "sync-a");
    SyncState loaded = restored.loadFromStore();

    assertEquals(flushed, loaded);
    assertEquals(LogPosition.parse("0/16B3748"), loaded.stream(USERS).logPosition());
  }

  @Test
  void unreadableStreamEntryIsDroppedAlone() {
    StateManager manager = new StateManager();
    JsonObject persisted = new JsonObject().put("streams", new JsonObject()
      .put("public.orders", new JsonObject().put("cursorField", "id").put("cursor", 7))
      .put("public.users", new JsonObject().put("logPosition", "not-a-position")));

    SyncState state = manager.load(persisted);

    assertEquals(7, state.stream(ORDERS).cursorValue());
    assertTrue(state.stream(USERS).isEmpty());
  }

  @Test
  void malformedBlobIsCorrupt() {
    assertThrows(StateCorruptException.class, () -> new StateManager().load("[1,2,3]"));
  }

  @Test
  void failingStoreSurfacesAsSourceException() {
    StateStore broken = new StateStore() {
      @Override
      public Optional<String> load(String key) {
        return Optional.empty();
      }

      @Override
      public void save(String key, String state) throws Exception {
        throw new java.io.IOException("disk full");
      }
    };
    StateManager manager = new StateManager(broken, "k");

    SourceException error = assertThrows(SourceException.class, manager::flush);
    assertTrue(error.getCause() instanceof java.io.IOException);
  }
}
