package io.neotool.kafka.consumer.sequencer;

/** Work queued behind a partition permit. */
public interface SequencedTask {

  /**
   * Runs once the task owns the partition. The task must eventually release the permit, possibly
   * from another thread.
   */
  void run(PartitionPermit permit);

  /** Called instead of {@link #run} when the queue is cleared, e.g. on partition revocation. */
  default void abandon() {}
}
