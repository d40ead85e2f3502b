package consumer.runtime;

/**
 * Result of processing one delivery. Derived per invocation, never stored.
 */
public enum DeliveryOutcome
{
  SUCCESS,
  TRANSIENT_FAILURE,
  TERMINAL_FAILURE
}
