package dev.henneberger.vertx.source.core;

public enum LogReaderState {
  DISCONNECTED,
  CONNECTING,
  STREAMING,
  RECONNECTING,
  CLOSED
}
