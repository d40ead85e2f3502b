package verticle;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import consumer.nats.NatsClient;
import consumer.nats.NatsConsumerPoolManager;
import consumer.nats.NatsConsumerPoolManager.DeliveryMode;
import consumer.nats.NatsDeadLetterHandler;
import consumer.router.HandlerNames;
import consumer.router.SubjectRouter;
import consumer.runtime.ConsumerConfig;
import consumer.runtime.ConsumerErrorHandler;
import consumer.runtime.ConsumerRuntime;
import consumer.runtime.ErrorAckBehavior;

import io.nats.client.JetStreamSubscription;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.WorkerExecutor;

import processor.OrderMsgProcessor;
import utils.OrderServiceConfig;

/**
 * Order Consumer Verticle
 *
 * Routes order events from the orders stream through a SubjectRouter and lets the
 * ConsumerRuntime settle each delivery. Binds as push or pull consumer depending on config.
 */
public class OrderConsumerVert extends AbstractVerticle
{
  private static final Logger LOGGER = LoggerFactory.getLogger( OrderConsumerVert.class );

  private final NatsClient         natsClient;
  private final OrderServiceConfig config;

  private WorkerExecutor    workerExecutor;
  private OrderMsgProcessor processor;
  private ConsumerRuntime   runtime;

  public OrderConsumerVert( NatsClient natsClient, OrderServiceConfig config )
  {
    this.natsClient = natsClient;
    this.config     = config;
  }

  @Override
  public void start( Promise<Void> startPromise )
  {
    ConsumerConfig consumerConfig = config.getConsumerConfig();

    LOGGER.info( "OrderConsumerVert initializing - stream={} durable={} mode={}",
                 consumerConfig.getStreamName(), consumerConfig.getDurableName(), config.getDeliveryMode() );

    try
    {
      workerExecutor = vertx.createSharedWorkerExecutor( "order-msg-handler", config.getWorkerPoolSize() );
      processor      = new OrderMsgProcessor( workerExecutor );

      SubjectRouter router = processor.buildRouter();
      checkRouter( router, consumerConfig );

      runtime = new ConsumerRuntime( consumerConfig, router::handle, errorHandler( consumerConfig ) );

      bind()
        .onSuccess( sub -> {
          LOGGER.info( "OrderConsumerVert started - consumer {} bound ({}) on {}",
                       runtime.getConsumerKey(), config.getDeliveryMode(), sub.getSubject() );
          startPromise.complete();
        } )
        .onFailure( e -> {
          LOGGER.error( "Failed to start OrderConsumerVert: {}", e.getMessage(), e );
          cleanup();
          startPromise.fail( e );
        } );
    }
    catch( Exception e )
    {
      LOGGER.error( "Exception during OrderConsumerVert initialization: {}", e.getMessage(), e );
      cleanup();
      startPromise.fail( e );
    }
  }

  private Future<JetStreamSubscription> bind()
  {
    NatsConsumerPoolManager pool = natsClient.getConsumerPoolManager();

    if( config.getDeliveryMode() == DeliveryMode.PULL )
      return pool.bindPullConsumerAsync( runtime, config.getBatchSize(), config.getFetchTimeoutMs(),
                                         config.getPullIntervalMs(), config.isAutoCreate() );

    return pool.bindPushConsumerAsync( runtime, config.isAutoCreate() );
  }

  private ConsumerErrorHandler errorHandler( ConsumerConfig consumerConfig )
  {
    if( !config.isDeadLetter() )
      return ( msg, error, attempt ) -> {
        LOGGER.error( "Giving up on order event {} after {} attempts: {}", msg.getSubject(), attempt, error.getMessage() );
        return Future.succeededFuture();
      };

    if( consumerConfig.getErrorAckBehavior() != ErrorAckBehavior.DELEGATED )
      LOGGER.warn( "Dead letter handling enabled with errorAckBehavior={} - the dead letter handler acks itself, DELEGATED is expected",
                   consumerConfig.getErrorAckBehavior() );

    return new NatsDeadLetterHandler( vertx, natsClient );
  }

  /**
   * Startup self check: every configured subject should be routable.
   */
  private void checkRouter( SubjectRouter router, ConsumerConfig consumerConfig )
  {
    List<String> missing = router.getMissingHandlers();
    if( !missing.isEmpty() )
      LOGGER.warn( "Subjects without implemented handler (messages will go to fallback): {}", missing );

    for( String subject : consumerConfig.getSubjects() )
    {
      if( !router.getSubjects().contains( subject ) )
        LOGGER.warn( "Consumer subject '{}' is not registered with the router", subject );

      if( !HandlerNames.subjectMatches( consumerConfig.getFilterSubject(), subject ) )
        LOGGER.warn( "Consumer subject '{}' is outside filter '{}' and will never be delivered", subject, consumerConfig.getFilterSubject() );
    }

    LOGGER.info( "Handler ids: {}", router.getHandlerIds() );
  }

  @Override
  public void stop( Promise<Void> stopPromise )
  {
    LOGGER.info( "Stopping OrderConsumerVert - success={} errors={}",
                 runtime == null ? 0 : runtime.getTotalSuccessCount(),
                 runtime == null ? 0 : runtime.getTotalErrorCount() );

    if( runtime == null )
    {
      cleanup();
      stopPromise.complete();
      return;
    }

    natsClient.getConsumerPoolManager().unbind( runtime )
      .onComplete( ar -> {
        if( ar.failed() )
          LOGGER.warn( "Unbind failed: {}", ar.cause().getMessage() );
        cleanup();
        stopPromise.complete();
      } );
  }

  private void cleanup()
  {
    if( workerExecutor != null )
    {
      workerExecutor.close();
      workerExecutor = null;
    }
  }

  public ConsumerRuntime   getRuntime()   { return runtime;   }
  public OrderMsgProcessor getProcessor() { return processor; }
}
