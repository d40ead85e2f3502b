package consumer.exceptions;

/**
 * Raised eagerly while building a consumer, router or connection from invalid settings.
 * Never retried.
 */
public class ConsumerConfigurationException extends IllegalArgumentException
{
  private static final long serialVersionUID = 3108544127796302917L;

  public ConsumerConfigurationException( String msg )
  {
    super( msg );
  }

  public ConsumerConfigurationException( String msg, Throwable cause )
  {
    super( msg, cause );
  }
}
