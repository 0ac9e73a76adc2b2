package org.waabox.swipermonitor;

/**
 * The states of the {@link SwiperMonitor} poll cycle.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum MonitorState {

  /** Created, the loop has not started. */
  IDLE,

  /** Validating connectivity with a round-trip query. */
  HEALTH_CHECKING,

  /** Opening the connection used by the fetch. */
  CONNECTING,

  /** Querying the event store for events newer than the watermark. */
  FETCHING,

  /** Submitting the fetched events to the dispatcher. */
  DISPATCHING,

  /** Writing the metrics file. */
  PERSISTING,

  /** Waiting for the poll interval or the shutdown signal. */
  SLEEPING,

  /** Persisting final metrics and draining the dispatcher. */
  SHUTTING_DOWN,

  /** The loop has exited. */
  STOPPED
}
