package com.scholary.radio.recorder.trigger;

import java.util.List;

/**
 * In-process timer that holds armed triggers keyed by a stable job id.
 *
 * <p>Registration and deregistration for the same id are serialized. Callbacks run on a
 * scheduler-owned thread and must return quickly; long work belongs on the completion monitor
 * pool.
 */
public interface TriggerScheduler {

  /** Begin accepting registrations and firing triggers. */
  void start();

  /** Cancel every armed trigger and stop firing. Running callbacks are not interrupted. */
  void stop();

  boolean isRunning();

  /**
   * Arm a trigger, replacing any existing registration with the same id.
   *
   * @param jobId stable identifier, e.g. {@code recurring:12}
   * @param trigger when to fire
   * @param callback what to run at fire time
   */
  void register(String jobId, TriggerSpec trigger, Runnable callback);

  /**
   * Disarm a trigger. Unknown ids are logged and ignored.
   *
   * @return true if a trigger was armed under this id
   */
  boolean deregister(String jobId);

  /** Currently armed job ids, sorted. For diagnostics. */
  List<String> list();
}
