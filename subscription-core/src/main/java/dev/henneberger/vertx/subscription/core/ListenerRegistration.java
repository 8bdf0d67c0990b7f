package dev.henneberger.vertx.subscription.core;

@FunctionalInterface
public interface ListenerRegistration {
  void cancel();
}
