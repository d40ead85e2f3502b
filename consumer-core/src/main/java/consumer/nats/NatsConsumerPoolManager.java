package consumer.nats;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import consumer.exceptions.ConsumerConfigurationException;
import consumer.runtime.ConsumerConfig;
import consumer.runtime.ConsumerRuntime;
import consumer.runtime.DeliveryOutcome;

import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PullSubscribeOptions;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.ConsumerInfo;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Vertx;

/**
 * Binds ConsumerRuntimes to JetStream durables and feeds them deliveries.
 *
 * - Pull: a periodic timer fetches batches on a worker thread; each fetched message is then
 *   processed on the binding context.
 * - Push: the broker pushes to the consumer's deliver subject; the dispatcher callback hops onto
 *   the binding context.
 *
 * In both modes every delivery is handed to ConsumerRuntime.processMessage() without waiting for
 * earlier deliveries, so completion order may differ from delivery order.
 */
public class NatsConsumerPoolManager
{
  private static final Logger LOGGER = LoggerFactory.getLogger( NatsConsumerPoolManager.class );

  static final int API_CONSUMER_NOT_FOUND = 10014;
  static final int API_STREAM_NOT_FOUND   = 10059;

  private final Vertx      vertx;
  private final NatsClient natsClient;

  private final ConcurrentHashMap<String, ConsumerContext>    consumerPool     = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, ConsumerDescriptor> consumerRegistry = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, Long>               pullTimers       = new ConcurrentHashMap<>();

  public enum DeliveryMode
  {
    PULL,
    PUSH
  }

  /**
   * Live subscription state for one bound consumer.
   */
  private static class ConsumerContext
  {
    final JetStreamSubscription subscription;
    final Dispatcher            dispatcher;
    final Connection            connection;
    final AtomicBoolean         fetchInProgress = new AtomicBoolean( false );

    ConsumerContext( JetStreamSubscription subscription, Dispatcher dispatcher, Connection connection )
    {
      this.subscription = subscription;
      this.dispatcher   = dispatcher;
      this.connection   = connection;
    }

    boolean isSubscriptionActive()
    {
      try
      {
        return subscription != null && subscription.isActive();
      }
      catch( Throwable t )
      {
        return true; // Conservative assumption
      }
    }
  }

  /**
   * What was bound and how, kept for health reporting.
   */
  public static class ConsumerDescriptor
  {
    private final ConsumerRuntime runtime;
    private final DeliveryMode    mode;
    private final int             batchSize;
    private final long            fetchTimeoutMs;
    private final long            pullIntervalMs;
    private final boolean         autoCreate;

    public ConsumerDescriptor( ConsumerRuntime runtime, DeliveryMode mode, int batchSize,
                               long fetchTimeoutMs, long pullIntervalMs, boolean autoCreate )
    {
      this.runtime        = runtime;
      this.mode           = mode;
      this.batchSize      = batchSize;
      this.fetchTimeoutMs = fetchTimeoutMs;
      this.pullIntervalMs = pullIntervalMs;
      this.autoCreate     = autoCreate;
    }

    public ConsumerRuntime getRuntime()        { return runtime;        }
    public DeliveryMode    getMode()           { return mode;           }
    public int             getBatchSize()      { return batchSize;      }
    public long            getFetchTimeoutMs() { return fetchTimeoutMs; }
    public long            getPullIntervalMs() { return pullIntervalMs; }
    public boolean         isAutoCreate()      { return autoCreate;     }
  }

  public NatsConsumerPoolManager( Vertx vertx, NatsClient natsClient )
  {
    this.vertx      = vertx;
    this.natsClient = natsClient;
  }

  /**
   * Bind the runtime to its durable as a pull consumer and start fetching.
   *
   * @param runtime        consumer to feed
   * @param batchSize      messages per fetch
   * @param fetchTimeoutMs max wait of one fetch
   * @param pullIntervalMs interval between fetch attempts
   * @param autoCreate     create the server-side durable when missing
   * @return Future with the bound subscription, failed without subscribing when a pull setting is not positive
   */
  public Future<JetStreamSubscription> bindPullConsumerAsync( ConsumerRuntime runtime, int batchSize,
                                                              long fetchTimeoutMs, long pullIntervalMs, boolean autoCreate )
  {
    if( batchSize <= 0 || fetchTimeoutMs <= 0 || pullIntervalMs <= 0 )
      return Future.failedFuture( new ConsumerConfigurationException(
        String.format( "Pull settings must be greater than 0: batchSize=%d fetchTimeoutMs=%d pullIntervalMs=%d",
                       batchSize, fetchTimeoutMs, pullIntervalMs ) ) );

    String         key    = runtime.getConsumerKey();
    ConsumerConfig config = runtime.getConfig();

    return vertx.executeBlocking( () -> {
      Connection conn = requireConnection();

      LOGGER.info( "Binding pull consumer: stream={} durable={} filter='{}' autoCreate={}",
                   config.getStreamName(), config.getDurableName(), config.getFilterSubject(), autoCreate );

      ensureServerConsumer( conn, config, DeliveryMode.PULL, autoCreate );

      JetStream             js           = conn.jetStream();
      PullSubscribeOptions  pullOpts     = PullSubscribeOptions.bind( config.getStreamName(), config.getDurableName() );
      JetStreamSubscription subscription = js.subscribe( config.getFilterSubject(), pullOpts );

      return subscription;
    } )
    .map( subscription -> {
      unbindQuietly( key );

      ConsumerContext ctx = new ConsumerContext( subscription, null, natsClient.getConnectionForNewOperations() );
      consumerPool.put( key, ctx );
      consumerRegistry.put( key, new ConsumerDescriptor( runtime, DeliveryMode.PULL, batchSize, fetchTimeoutMs, pullIntervalMs, autoCreate ) );

      long timerId = vertx.setPeriodic( pullIntervalMs, id -> pullMessagesAsync( key, ctx, runtime, batchSize, fetchTimeoutMs ) );
      pullTimers.put( key, timerId );

      LOGGER.info( "Bound to pull consumer: {} batchSize={} fetchTimeout={}ms pullInterval={}ms",
                   key, batchSize, fetchTimeoutMs, pullIntervalMs );
      return subscription;
    } );
  }

  /**
   * Bind the runtime to its durable as a push consumer delivering to runtime.getDeliverSubject().
   */
  public Future<JetStreamSubscription> bindPushConsumerAsync( ConsumerRuntime runtime, boolean autoCreate )
  {
    String         key     = runtime.getConsumerKey();
    ConsumerConfig config  = runtime.getConfig();
    Context        context = vertx.getOrCreateContext();

    return vertx.executeBlocking( () -> {
      Connection conn = requireConnection();

      LOGGER.info( "Binding push consumer: stream={} durable={} filter='{}' deliverSubject='{}' autoCreate={}",
                   config.getStreamName(), config.getDurableName(), config.getFilterSubject(),
                   config.getDeliverSubject(), autoCreate );

      ensureServerConsumer( conn, config, DeliveryMode.PUSH, autoCreate );

      Dispatcher            dispatcher   = conn.createDispatcher();
      JetStream             js           = conn.jetStream();
      PushSubscribeOptions  pushOpts     = PushSubscribeOptions.bind( config.getStreamName(), config.getDurableName() );
      JetStreamSubscription subscription = js.subscribe( config.getFilterSubject(), dispatcher,
                                                         msg -> context.runOnContext( v -> run( runtime, msg ) ),
                                                         false, pushOpts );

      unbindQuietly( key );
      consumerPool.put( key, new ConsumerContext( subscription, dispatcher, conn ) );
      consumerRegistry.put( key, new ConsumerDescriptor( runtime, DeliveryMode.PUSH, 0, 0, 0, autoCreate ) );

      LOGGER.info( "Bound to push consumer: {} deliverSubject={}", key, config.getDeliverSubject() );
      return subscription;
    } );
  }

  /**
   * Per-delivery entry point: hand the message to the runtime and log anything it could not settle.
   */
  public Future<DeliveryOutcome> run( ConsumerRuntime runtime, Message msg )
  {
    return runtime.processMessage( msg )
                  .onFailure( err -> LOGGER.error( "Delivery for consumer {} subject={} was not settled: {}",
                                                   runtime.getConsumerKey(), msg.getSubject(), err.getMessage(), err ) );
  }

  private void pullMessagesAsync( String key, ConsumerContext ctx, ConsumerRuntime runtime, int batchSize, long fetchTimeoutMs )
  {
    if( !ctx.isSubscriptionActive() )
    {
      LOGGER.debug( "Subscription {} is inactive - skipping pull", key );
      return;
    }

    // One outstanding fetch per consumer; handlers of fetched messages are not waited for.
    if( !ctx.fetchInProgress.compareAndSet( false, true ) )
      return;

    vertx.<List<Message>>executeBlocking( () -> ctx.subscription.fetch( batchSize, Duration.ofMillis( fetchTimeoutMs ) ), false )
      .onComplete( ar -> {
        ctx.fetchInProgress.set( false );

        if( ar.failed() )
        {
          LOGGER.warn( "Pull failed for consumer {}: {}", key, ar.cause() != null ? ar.cause().getMessage() : "unknown" );
          return;
        }

        List<Message> messages = ar.result();
        if( messages == null || messages.isEmpty() )
          return;

        LOGGER.debug( "Fetched {} messages for consumer {}", messages.size(), key );

        for( Message msg : messages )
        {
          run( runtime, msg );
        }
      } );
  }

  private Connection requireConnection()
  {
    Connection conn = natsClient.getConnectionForNewOperations();
    if( conn == null || conn.getStatus() != Connection.Status.CONNECTED )
      throw new IllegalStateException( "No NATS connection available for consumer binding" );

    return conn;
  }

  /**
   * Ensure the server-side durable exists with the expected filter (and deliver subject for push),
   * or create it when autoCreate is set. Does not touch local state.
   */
  void ensureServerConsumer( Connection conn, ConsumerConfig config, DeliveryMode mode, boolean autoCreate ) throws Exception
  {
    JetStreamManagement jsm     = conn.jetStreamManagement();
    String              stream  = config.getStreamName();
    String              durable = config.getDurableName();

    try
    {
      ConsumerInfo          info   = jsm.getConsumerInfo( stream, durable );
      ConsumerConfiguration remote = info.getConsumerConfiguration();

      LOGGER.debug( "Server-side consumer '{}' on stream '{}' present; filterSubject='{}' deliverSubject='{}' maxDeliver={}",
                    durable, stream, remote.getFilterSubject(), remote.getDeliverSubject(), remote.getMaxDeliver() );

      if( remote.getFilterSubject() != null && !config.getFilterSubject().equals( remote.getFilterSubject() ) )
      {
        throw new IllegalStateException( String.format( "Consumer '%s' filter mismatch: expected='%s' got='%s'",
                                                        durable, config.getFilterSubject(), remote.getFilterSubject() ) );
      }

      if( mode == DeliveryMode.PUSH && remote.getDeliverSubject() == null )
        throw new IllegalStateException( "Consumer '" + durable + "' is a pull consumer and cannot be bound for push delivery" );

      if( mode == DeliveryMode.PULL && remote.getDeliverSubject() != null )
        throw new IllegalStateException( "Consumer '" + durable + "' is a push consumer and cannot be bound for pull delivery" );

      if( remote.getMaxDeliver() != config.getMaxDeliver() )
      {
        LOGGER.warn( "Consumer '{}' maxDeliver on server is {} but configured {} - terminal failures follow the configured value",
                     durable, remote.getMaxDeliver(), config.getMaxDeliver() );
      }
      return;
    }
    catch( JetStreamApiException e )
    {
      if( e.getApiErrorCode() == API_STREAM_NOT_FOUND )
        throw new IllegalStateException( "Stream not found: " + stream, e );

      if( e.getApiErrorCode() != API_CONSUMER_NOT_FOUND )
        throw e;

      if( !autoCreate )
        throw new IllegalStateException( "Server-side consumer not found: " + durable, e );
    }

    LOGGER.info( "Server-side consumer '{}' on stream '{}' not found. Creating with filter='{}'", durable, stream, config.getFilterSubject() );

    jsm.addOrUpdateConsumer( stream, buildServerConfiguration( config, mode ) );

    LOGGER.info( "Successfully created server-side consumer '{}' on stream '{}'", durable, stream );
  }

  static ConsumerConfiguration buildServerConfiguration( ConsumerConfig config, DeliveryMode mode )
  {
    ConsumerConfiguration.Builder builder = ConsumerConfiguration.builder()
      .durable( config.getDurableName() )
      .filterSubject( config.getFilterSubject() )
      .ackPolicy( AckPolicy.Explicit )
      .maxDeliver( config.getMaxDeliver() );

    if( mode == DeliveryMode.PUSH )
      builder.deliverSubject( config.getDeliverSubject() );

    return builder.build();
  }

  /**
   * Stop feeding the runtime. The server-side durable is left in place.
   */
  public Future<Void> unbind( ConsumerRuntime runtime )
  {
    String key = runtime.getConsumerKey();
    return vertx.executeBlocking( () -> {
      unbindQuietly( key );
      consumerRegistry.remove( key );
      return null;
    } );
  }

  /**
   * Cancel the pull timer and unsubscribe, logging instead of failing.
   */
  private void unbindQuietly( String key )
  {
    Long timerId = pullTimers.remove( key );
    if( timerId != null )
    {
      vertx.cancelTimer( timerId );
      LOGGER.debug( "Cancelled pull timer for {}", key );
    }

    ConsumerContext ctx = consumerPool.remove( key );
    if( ctx == null )
      return;

    try
    {
      if( ctx.subscription != null )
      {
        ctx.subscription.unsubscribe();
        LOGGER.debug( "Unsubscribed consumer: {}", key );
      }
      if( ctx.dispatcher != null && ctx.connection != null )
      {
        ctx.connection.closeDispatcher( ctx.dispatcher );
      }
    }
    catch( Exception e )
    {
      LOGGER.warn( "Error unsubscribing consumer {}: {}", key, e.getMessage() );
    }
  }

  public Map<String, ConsumerDescriptor> getRegisteredConsumers()
  {
    return new HashMap<>( consumerRegistry );
  }

  public Map<String, Object> getPoolHealthStatus()
  {
    Map<String, Object> health = new HashMap<>();

    health.put( "activeConsumers",     consumerPool.size() );
    health.put( "registeredConsumers", consumerRegistry.size() );
    health.put( "activePullTimers",    pullTimers.size() );

    Map<String, Map<String, Long>> counters = new HashMap<>();
    for( Map.Entry<String, ConsumerDescriptor> entry : consumerRegistry.entrySet() )
    {
      ConsumerRuntime   runtime = entry.getValue().getRuntime();
      Map<String, Long> stats   = new HashMap<>();
      stats.put( "totalSuccessCount", runtime.getTotalSuccessCount() );
      stats.put( "totalErrorCount",   runtime.getTotalErrorCount()   );
      counters.put( entry.getKey(), stats );
    }
    health.put( "consumerCounters", counters );

    return health;
  }

  public void shutdown()
  {
    LOGGER.info( "Shutting down consumer pool" );

    for( String key : consumerPool.keySet() )
    {
      unbindQuietly( key );
    }
    consumerRegistry.clear();

    LOGGER.info( "Consumer pool shutdown complete" );
  }
}
