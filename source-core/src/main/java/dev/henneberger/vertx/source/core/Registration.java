package dev.henneberger.vertx.source.core;

@FunctionalInterface
public interface Registration {
  void cancel();
}
