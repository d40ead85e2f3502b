package consumer.runtime;

import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.nats.client.Message;
import io.nats.client.impl.NatsJetStreamMetaData;
import io.vertx.core.Future;

/**
 * Per-message ack/retry state machine for one consumer.
 *
 * The handler runs once per delivery. Its outcome together with the broker reported delivery
 * count decides what happens to the message:
 *
 * <pre>
 *   attempt &lt;  maxDeliver, success   -> ack,  success + 1
 *   attempt &lt;  maxDeliver, failure   -> nak,  broker redelivers
 *   attempt &gt;= maxDeliver, success   -> ack,  success + 1
 *   attempt &gt;= maxDeliver, failure   -> error + 1, handleError(), then NAK / ACK / nothing
 * </pre>
 *
 * Deliveries are not serialized: processMessage() returns as soon as the handler future is
 * wired, so a slow message only holds back its own ack. Counters are owned by this instance
 * and only grow.
 */
public class ConsumerRuntime
{
  private static final Logger LOGGER = LoggerFactory.getLogger( ConsumerRuntime.class );

  private final ConsumerConfig       config;
  private final MessageHandler       messageHandler;
  private final ConsumerErrorHandler errorHandler;

  private final AtomicLong totalSuccessCount = new AtomicLong( 0 );
  private final AtomicLong totalErrorCount   = new AtomicLong( 0 );

  public ConsumerRuntime( ConsumerConfig config, MessageHandler messageHandler )
  {
    this( config, messageHandler, ConsumerErrorHandler.noop() );
  }

  public ConsumerRuntime( ConsumerConfig config, MessageHandler messageHandler, ConsumerErrorHandler errorHandler )
  {
    if( config == null )
      throw new IllegalArgumentException( "ConsumerConfig cannot be null" );
    if( messageHandler == null )
      throw new IllegalArgumentException( "MessageHandler cannot be null" );

    this.config         = config;
    this.messageHandler = messageHandler;
    this.errorHandler   = errorHandler == null ? ConsumerErrorHandler.noop() : errorHandler;
  }

  /**
   * Process one delivery and apply the ack decision.
   *
   * @return Future with the outcome. Fails only when ack/nak cannot be sent or when the error
   *         handler itself fails; handler failures are consumed here.
   */
  public Future<DeliveryOutcome> processMessage( Message msg )
  {
    Future<Void> handled;
    try
    {
      handled = messageHandler.handleMessage( msg );
      if( handled == null )
        handled = Future.succeededFuture();
    }
    catch( Exception e )
    {
      handled = Future.failedFuture( e );
    }

    return handled.transform( ar -> ar.succeeded() ? onSuccess( msg ) : onFailure( msg, ar.cause() ) );
  }

  private Future<DeliveryOutcome> onSuccess( Message msg )
  {
    try
    {
      msg.ack();
    }
    catch( Exception e )
    {
      LOGGER.warn( "Failed to ack message seq={} for {}: {}", streamSequence( msg ), getConsumerKey(), e.getMessage() );
      return Future.failedFuture( e );
    }

    totalSuccessCount.incrementAndGet();
    LOGGER.debug( "Message ack'd for consumer {} subject={} seq={}", getConsumerKey(), msg.getSubject(), streamSequence( msg ) );

    return Future.succeededFuture( DeliveryOutcome.SUCCESS );
  }

  private Future<DeliveryOutcome> onFailure( Message msg, Throwable cause )
  {
    Long attempt = deliveryAttempt( msg );

    if( attempt == null )
    {
      // Without broker metadata the attempt count is unknown; leave the retry cap to the broker.
      LOGGER.error( "Handler failed for consumer {} subject={} and delivery metadata is unavailable - NAKing: {}",
                    getConsumerKey(), msg.getSubject(), errorText( cause ) );
      return nak( msg, DeliveryOutcome.TRANSIENT_FAILURE );
    }

    if( attempt < config.getMaxDeliver() )
    {
      LOGGER.warn( "Handler failed for consumer {} subject={} seq={} (attempt {}/{}) - NAKing for redelivery: {}",
                   getConsumerKey(), msg.getSubject(), streamSequence( msg ), attempt, config.getMaxDeliver(), errorText( cause ) );
      return nak( msg, DeliveryOutcome.TRANSIENT_FAILURE );
    }

    return onTerminalFailure( msg, cause, attempt );
  }

  private Future<DeliveryOutcome> onTerminalFailure( Message msg, Throwable cause, long attempt )
  {
    totalErrorCount.incrementAndGet();

    LOGGER.error( "Message processing failed permanently for consumer {} subject={} seq={} after {} attempts (policy {})",
                  getConsumerKey(), msg.getSubject(), streamSequence( msg ), attempt, config.getErrorAckBehavior(), cause );

    Future<Void> handled;
    try
    {
      handled = errorHandler.handleError( msg, cause, attempt );
      if( handled == null )
        handled = Future.succeededFuture();
    }
    catch( Exception e )
    {
      handled = Future.failedFuture( e );
    }

    return handled.compose( v -> {
      switch( config.getErrorAckBehavior() )
      {
        case ACK:
          return ack( msg, DeliveryOutcome.TERMINAL_FAILURE );
        case DELEGATED:
          LOGGER.debug( "Terminal failure for seq={} delegated to error handler - no ack/nak sent", streamSequence( msg ) );
          return Future.succeededFuture( DeliveryOutcome.TERMINAL_FAILURE );
        case NAK:
        default:
          return nak( msg, DeliveryOutcome.TERMINAL_FAILURE );
      }
    } );
  }

  private Future<DeliveryOutcome> ack( Message msg, DeliveryOutcome outcome )
  {
    try
    {
      msg.ack();
      LOGGER.debug( "Message ack'd for consumer {} seq={}", getConsumerKey(), streamSequence( msg ) );
      return Future.succeededFuture( outcome );
    }
    catch( Exception e )
    {
      LOGGER.warn( "Failed to ack message seq={} for {}: {}", streamSequence( msg ), getConsumerKey(), e.getMessage() );
      return Future.failedFuture( e );
    }
  }

  private Future<DeliveryOutcome> nak( Message msg, DeliveryOutcome outcome )
  {
    try
    {
      msg.nak();
      LOGGER.debug( "Message nak'd for consumer {} seq={}", getConsumerKey(), streamSequence( msg ) );
      return Future.succeededFuture( outcome );
    }
    catch( Exception e )
    {
      LOGGER.warn( "Failed to nak message seq={} for {}: {}", streamSequence( msg ), getConsumerKey(), e.getMessage() );
      return Future.failedFuture( e );
    }
  }

  /**
   * Broker reported delivery count, or null for messages without JetStream metadata.
   */
  static Long deliveryAttempt( Message msg )
  {
    NatsJetStreamMetaData metaData = metaData( msg );
    return metaData == null ? null : metaData.deliveredCount();
  }

  static Long streamSequence( Message msg )
  {
    NatsJetStreamMetaData metaData = metaData( msg );
    return metaData == null ? null : metaData.streamSequence();
  }

  private static NatsJetStreamMetaData metaData( Message msg )
  {
    try
    {
      return msg.metaData();
    }
    catch( IllegalStateException e )
    {
      // not a JetStream message
      return null;
    }
  }

  private static String errorText( Throwable cause )
  {
    if( cause == null )
      return "unknown";
    return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
  }

  public String getConsumerKey()
  {
    return config.getStreamName() + ":" + config.getDurableName();
  }

  public String getDeliverSubject()
  {
    return config.getDeliverSubject();
  }

  public ConsumerConfig       getConfig()            { return config;                  }
  public MessageHandler       getMessageHandler()    { return messageHandler;          }
  public ConsumerErrorHandler getErrorHandler()      { return errorHandler;            }
  public long                 getTotalErrorCount()   { return totalErrorCount.get();   }

  /**
   * Deliveries whose handler future succeeded. This includes messages a routing fallback already
   * settled itself (the default fallback NAKs), so it counts settled deliveries, not processed events.
   */
  public long getTotalSuccessCount()
  {
    return totalSuccessCount.get();
  }
}
