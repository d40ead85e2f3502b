package consumer.nats;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import consumer.runtime.ConsumerErrorHandler;

import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.Message;
import io.nats.client.api.DiscardPolicy;
import io.nats.client.api.PublishAck;
import io.nats.client.api.StorageType;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.impl.Headers;
import io.nats.client.impl.NatsJetStreamMetaData;
import io.vertx.core.Future;
import io.vertx.core.Vertx;

/**
 * Error handler for the DELEGATED policy: republish a permanently failed message to
 * "dlq.&lt;subject&gt;" with failure headers, then ack the original.
 *
 * If the republish fails the original is left un-acked and the broker redelivers it after its
 * ack wait.
 */
public class NatsDeadLetterHandler implements ConsumerErrorHandler
{
  private static final Logger LOGGER = LoggerFactory.getLogger( NatsDeadLetterHandler.class );

  public static final String DLQ_STREAM_PREFIX  = "DLQ_";
  public static final String DLQ_SUBJECT_PREFIX = "dlq.";

  // Header values must be printable ASCII
  static final int MAX_HEADER_VALUE_LENGTH = 512;

  public static final String HDR_ORIGINAL_SUBJECT  = "original-subject";
  public static final String HDR_ORIGINAL_STREAM   = "original-stream";
  public static final String HDR_ORIGINAL_SEQUENCE = "original-sequence";
  public static final String HDR_DELIVERY_ATTEMPT  = "delivery-attempt";
  public static final String HDR_FAILURE_TIME      = "failure-timestamp";
  public static final String HDR_DLQ_REASON        = "dlq-reason";

  private final Vertx      vertx;
  private final NatsClient natsClient;
  private final boolean    ensureStreams;

  // Streams known to exist, avoids repeated API calls
  private final ConcurrentHashMap<String, Boolean> createdStreams = new ConcurrentHashMap<>();

  public NatsDeadLetterHandler( Vertx vertx, NatsClient natsClient )
  {
    this( vertx, natsClient, true );
  }

  /**
   * @param ensureStreams create a DLQ_&lt;SUBJECT&gt; stream for the dead letter subject when missing
   */
  public NatsDeadLetterHandler( Vertx vertx, NatsClient natsClient, boolean ensureStreams )
  {
    this.vertx         = vertx;
    this.natsClient    = natsClient;
    this.ensureStreams = ensureStreams;
  }

  @Override
  public Future<Void> handleError( Message msg, Throwable error, long attemptCount )
  {
    return vertx.<PublishAck>executeBlocking( () -> sendToDeadLetterQueue( msg, error, attemptCount ), false )
      .map( ack -> {
        msg.ack();
        LOGGER.info( "Unprocessable message sent to dead letter subject and acknowledged: {} (dlq seq: {})",
                     msg.getSubject(), ack.getSeqno() );
        return (Void) null;
      } )
      .onFailure( e -> LOGGER.error( "Failed to send message to dead letter subject for: {} - leaving un-acked",
                                     msg.getSubject(), e ) );
  }

  PublishAck sendToDeadLetterQueue( Message msg, Throwable error, long attemptCount ) throws Exception
  {
    Connection conn = natsClient.getConnectionForNewOperations();
    if( conn == null )
      throw new IllegalStateException( "No NATS connection available for dead letter publish" );

    String originalSubject = msg.getSubject();
    String dlqSubject      = deadLetterSubject( originalSubject );

    if( ensureStreams )
      ensureDLQStreamExists( conn, deadLetterStream( originalSubject ), dlqSubject );

    Headers headers = new Headers();
    if( msg.getHeaders() != null )
    {
      for( String key : msg.getHeaders().keySet() )
      {
        headers.put( key, msg.getHeaders().get( key ) );
      }
    }

    headers.put( HDR_ORIGINAL_SUBJECT, headerValue( originalSubject ) );
    headers.put( HDR_DELIVERY_ATTEMPT, String.valueOf( attemptCount ) );
    headers.put( HDR_FAILURE_TIME,     String.valueOf( System.currentTimeMillis() ) );
    headers.put( HDR_DLQ_REASON,       headerValue( reason( error ) ) );

    NatsJetStreamMetaData metaData = jetStreamMetaData( msg );
    if( metaData != null )
    {
      headers.put( HDR_ORIGINAL_STREAM,   headerValue( metaData.getStream() ) );
      headers.put( HDR_ORIGINAL_SEQUENCE, String.valueOf( metaData.streamSequence() ) );
    }

    JetStream  js  = conn.jetStream();
    PublishAck ack = js.publish( dlqSubject, headers, msg.getData() );

    LOGGER.info( "Message sent to DLQ: {} -> {} (seq: {})", originalSubject, dlqSubject, ack.getSeqno() );
    return ack;
  }

  private void ensureDLQStreamExists( Connection conn, String streamName, String subject ) throws Exception
  {
    if( createdStreams.containsKey( streamName ) )
      return;

    JetStreamManagement jsm = conn.jetStreamManagement();
    try
    {
      jsm.getStreamInfo( streamName );
      createdStreams.put( streamName, true );
      LOGGER.debug( "DLQ Stream already exists: {}", streamName );
      return;
    }
    catch( JetStreamApiException e )
    {
      if( e.getApiErrorCode() != NatsConsumerPoolManager.API_STREAM_NOT_FOUND )
        throw e;
    }

    StreamConfiguration streamConfig = StreamConfiguration.builder()
      .name( streamName )
      .subjects( subject )
      .maxAge( Duration.ofDays( 7 ) )
      .maxMessages( 100000 )
      .storageType( StorageType.File )
      .replicas( 1 )
      .discardPolicy( DiscardPolicy.Old )
      .build();

    jsm.addStream( streamConfig );
    createdStreams.put( streamName, true );
    LOGGER.info( "Created DLQ stream: {} for subject: {}", streamName, subject );
  }

  /**
   * Prefixed rather than suffixed so that a source filter like "orders.&gt;" never matches the
   * dead letter subject of its own messages.
   */
  public static String deadLetterSubject( String subject )
  {
    return DLQ_SUBJECT_PREFIX + subject;
  }

  /**
   * Stream names may not contain '.', so everything outside [A-Za-z0-9_-] becomes '_'.
   */
  public static String deadLetterStream( String subject )
  {
    return DLQ_STREAM_PREFIX + subject.replaceAll( "[^a-zA-Z0-9_-]", "_" ).toUpperCase( Locale.ROOT );
  }

  private static String reason( Throwable error )
  {
    if( error == null )
      return "processing-failed";
    return error.getMessage() == null ? error.getClass().getName() : error.getClass().getName() + ": " + error.getMessage();
  }

  /**
   * Control characters (line breaks of multi-line exception messages included) become spaces,
   * non-ASCII characters become '?', and the result is capped at MAX_HEADER_VALUE_LENGTH.
   */
  static String headerValue( String value )
  {
    if( value == null )
      return "";

    int           length = Math.min( value.length(), MAX_HEADER_VALUE_LENGTH );
    StringBuilder sb     = new StringBuilder( length );
    for( int i = 0; i < length; i++ )
    {
      char c = value.charAt( i );
      if( c < 0x20 || c == 0x7F )
        sb.append( ' ' );
      else if( c > 0x7E )
        sb.append( '?' );
      else
        sb.append( c );
    }

    return sb.toString().trim();
  }

  private static NatsJetStreamMetaData jetStreamMetaData( Message msg )
  {
    try
    {
      return msg.metaData();
    }
    catch( IllegalStateException e )
    {
      return null;
    }
  }
}
