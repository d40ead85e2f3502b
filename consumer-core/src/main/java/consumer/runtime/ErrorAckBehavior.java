package consumer.runtime;

import java.util.Locale;

import consumer.exceptions.ConsumerConfigurationException;

/**
 * What to do with a message whose handler failed on its final delivery attempt.
 */
public enum ErrorAckBehavior
{
  /** NAK. The message stays in the stream for inspection; the broker stops at its own cap. */
  NAK,

  /** ACK. Accept the loss and remove the message permanently. */
  ACK,

  /** Neither. The error handler owns the outcome (manual ack, dead letter, intentional no-op). */
  DELEGATED;

  public static ErrorAckBehavior parse( String value )
  {
    if( value == null || value.isBlank() )
      return NAK;

    try
    {
      return valueOf( value.trim().toUpperCase( Locale.ROOT ) );
    }
    catch( IllegalArgumentException e )
    {
      throw new ConsumerConfigurationException( "Unknown error ack behavior: " + value, e );
    }
  }
}
