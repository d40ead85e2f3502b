package consumer.runtime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import consumer.exceptions.ConsumerConfigurationException;

/**
 * Immutable settings for one JetStream consumer.
 *
 * filterSubject defaults to the first subject, durableName to "default". The deliver subject
 * used by push consumers is derived as "&lt;durableName&gt;.deliver".
 */
public class ConsumerConfig
{
  private static final Logger LOGGER = LoggerFactory.getLogger( ConsumerConfig.class );

  private final String           streamName;
  private final List<String>     subjects;
  private final String           filterSubject;
  private final String           durableName;
  private final int              maxDeliver;
  private final ErrorAckBehavior errorAckBehavior;

  private ConsumerConfig( Builder builder )
  {
    this.streamName       = validateStreamName( builder.streamName );
    this.subjects         = validateSubjects( builder.subjects );
    this.filterSubject    = isBlank( builder.filterSubject ) ? subjects.get( 0 ) : builder.filterSubject;
    this.durableName      = isBlank( builder.durableName ) ? ConsumerConfigIF.DefaultDurableName : builder.durableName;
    this.errorAckBehavior = builder.errorAckBehavior == null ? ErrorAckBehavior.NAK : builder.errorAckBehavior;

    if( builder.maxDeliver < 1 )
      throw new ConsumerConfigurationException( "maxDeliver must be >= 1, got " + builder.maxDeliver );
    this.maxDeliver = builder.maxDeliver;
  }

  public static Builder builder()
  {
    return new Builder();
  }

  /**
   * Read a consumer configuration from flat key/value settings, see ConsumerConfigIF for keys.
   */
  public static ConsumerConfig fromMap( Map<String, String> data )
  {
    if( data == null )
      throw new ConsumerConfigurationException( "Consumer configuration data must not be null" );

    Builder builder = builder().streamName( data.get( ConsumerConfigIF.StreamName ) );

    String subjects = data.get( ConsumerConfigIF.Subjects );
    if( subjects != null )
    {
      for( String subject : subjects.split( "," ) )
      {
        if( !subject.isBlank() )
          builder.subject( subject.trim() );
      }
    }

    if( data.get( ConsumerConfigIF.FilterSubject ) != null ) builder.filterSubject( data.get( ConsumerConfigIF.FilterSubject ).trim() );
    if( data.get( ConsumerConfigIF.DurableName   ) != null ) builder.durableName(   data.get( ConsumerConfigIF.DurableName   ).trim() );
    if( data.get( ConsumerConfigIF.ErrorAck      ) != null ) builder.errorAckBehavior( ErrorAckBehavior.parse( data.get( ConsumerConfigIF.ErrorAck ) ) );

    String maxDeliver = data.get( ConsumerConfigIF.MaxDeliver );
    if( maxDeliver != null )
    {
      try
      {
        builder.maxDeliver( Integer.parseInt( maxDeliver.trim() ) );
      }
      catch( NumberFormatException e )
      {
        throw new ConsumerConfigurationException( "maxDeliver is not a number: " + maxDeliver, e );
      }
    }

    ConsumerConfig config = builder.build();

    LOGGER.info( "***************** Consumer Config is set for ******************" );
    LOGGER.info( ConsumerConfigIF.StreamName    + "       = " + config.streamName       );
    LOGGER.info( ConsumerConfigIF.Subjects      + "         = " + config.subjects         );
    LOGGER.info( ConsumerConfigIF.FilterSubject + "    = " + config.filterSubject    );
    LOGGER.info( ConsumerConfigIF.DurableName   + "      = " + config.durableName      );
    LOGGER.info( ConsumerConfigIF.MaxDeliver    + "       = " + config.maxDeliver       );
    LOGGER.info( ConsumerConfigIF.ErrorAck      + " = " + config.errorAckBehavior );
    LOGGER.info( "***************** End of Consumer Config ******************" );

    return config;
  }

  /**
   * Stream names may not contain whitespace, the subject delimiter '.', or wildcards.
   */
  public static String validateStreamName( String streamName )
  {
    if( isBlank( streamName ) )
      throw new ConsumerConfigurationException( "Stream name must not be empty" );

    for( int i = 0; i < streamName.length(); i++ )
    {
      char c = streamName.charAt( i );
      if( Character.isWhitespace( c ) || c == '.' || c == '*' || c == '>' )
        throw new ConsumerConfigurationException( "Invalid stream name '" + streamName + "': whitespace, '.', '*' and '>' are not allowed" );
    }

    return streamName;
  }

  private static List<String> validateSubjects( List<String> subjects )
  {
    if( subjects == null || subjects.isEmpty() )
      throw new ConsumerConfigurationException( "At least one subject is required" );

    for( String subject : subjects )
    {
      if( isBlank( subject ) )
        throw new ConsumerConfigurationException( "Subjects must not contain blank entries: " + subjects );
    }

    return Collections.unmodifiableList( new ArrayList<>( subjects ) );
  }

  private static boolean isBlank( String value )
  {
    return value == null || value.isBlank();
  }

  public String getDeliverSubject()
  {
    return durableName + ConsumerConfigIF.DeliverSubjectSuffix;
  }

  public String           getStreamName()       { return streamName;       }
  public List<String>     getSubjects()         { return subjects;         }
  public String           getFilterSubject()    { return filterSubject;    }
  public String           getDurableName()      { return durableName;      }
  public int              getMaxDeliver()       { return maxDeliver;       }
  public ErrorAckBehavior getErrorAckBehavior() { return errorAckBehavior; }

  @Override
  public String toString()
  {
    return String.format( "ConsumerConfig{stream=%s, subjects=%s, filter=%s, durable=%s, maxDeliver=%d, errorAck=%s}",
                          streamName, subjects, filterSubject, durableName, maxDeliver, errorAckBehavior );
  }

  public static class Builder
  {
    private String           streamName;
    private List<String>     subjects         = new ArrayList<>();
    private String           filterSubject;
    private String           durableName;
    private int              maxDeliver       = ConsumerConfigIF.DefaultMaxDeliver;
    private ErrorAckBehavior errorAckBehavior = ErrorAckBehavior.NAK;

    private Builder()
    {
    }

    public Builder streamName( String streamName )
    {
      this.streamName = streamName;
      return this;
    }

    public Builder subject( String subject )
    {
      this.subjects.add( subject );
      return this;
    }

    public Builder subjects( String... subjects )
    {
      this.subjects = new ArrayList<>( Arrays.asList( subjects ) );
      return this;
    }

    public Builder subjects( List<String> subjects )
    {
      this.subjects = subjects == null ? new ArrayList<>() : new ArrayList<>( subjects );
      return this;
    }

    public Builder filterSubject( String filterSubject )
    {
      this.filterSubject = filterSubject;
      return this;
    }

    public Builder durableName( String durableName )
    {
      this.durableName = durableName;
      return this;
    }

    public Builder maxDeliver( int maxDeliver )
    {
      this.maxDeliver = maxDeliver;
      return this;
    }

    public Builder errorAckBehavior( ErrorAckBehavior errorAckBehavior )
    {
      this.errorAckBehavior = errorAckBehavior;
      return this;
    }

    public ConsumerConfig build()
    {
      return new ConsumerConfig( this );
    }
  }
}
