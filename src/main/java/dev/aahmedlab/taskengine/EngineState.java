package dev.aahmedlab.taskengine;

/**
 * Lifecycle state of a {@link TaskEngine}.
 *
 * <p>Transitions only move forward: {@code CREATED -> RUNNING -> STOPPING -> STOPPED}. Stopping an
 * engine that was never started moves it from {@code CREATED} straight to {@code STOPPED}.
 *
 * @since 1.0.0
 */
public enum EngineState {
  CREATED,
  RUNNING,
  STOPPING,
  STOPPED
}
