package org.kpace.meter.enums;

/**
 * Represents the lifecycle states of a pace meter.
 *
 * <p>The state transitions generally follow this sequence:
 *
 * <ul>
 *   <li>RUNNING - Initial state; flushes happen every interval
 *   <li>PAUSED - Steps are still counted but nothing is flushed automatically
 *   <li>CLOSED - Final state after the timer has been released
 * </ul>
 *
 * <p>RUNNING and PAUSED alternate through pause and resume; both can move to CLOSED.
 */
public enum MeterState {
  /** The recurring timer is armed and flushes the meter every interval. */
  RUNNING,

  /** The timer is disarmed. Only manual reports flush the meter. */
  PAUSED,

  /**
   * The timer has been released for good. Steps are still counted and manual reports still flush,
   * but the meter can no longer be resumed.
   */
  CLOSED,
}
