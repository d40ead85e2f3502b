package service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import consumer.nats.NatsClient;

import model.ChildVerticle;
import utils.OrderServiceConfig;
import verticle.OrderConsumerVert;

/**
 * Order consumer service. Connects to NATS, deploys the OrderConsumerVert which binds the
 * durable JetStream consumer for the orders stream, and tears everything down in reverse order
 * on shutdown.
 *
 * Settings come from order-consumer.properties on the classpath, overridden by environment
 * variables named after the keys (natsUrls -> NATS_URLS, maxDeliver -> MAX_DELIVER, ...).
 */
public class OrderServiceMain
{
  private static final Logger LOGGER = LoggerFactory.getLogger( OrderServiceMain.class );

  private static final long DEPLOY_TIMEOUT_SECS = 60;
  private static final long CLOSE_TIMEOUT_SECS  = 30;

  private final OrderServiceConfig  config;
  private final List<ChildVerticle> deployedVerticles = new ArrayList<ChildVerticle>();

  private Vertx      vertx      = null;
  private NatsClient natsClient = null;

  public OrderServiceMain( OrderServiceConfig config )
  {
    this.config = config;

    try
    {
      VertxOptions options = new VertxOptions()
          .setWorkerPoolSize( 20 )
          .setEventLoopPoolSize( 4 )
          .setMaxWorkerExecuteTime( 120L * 1000 * 1000000 ) // 120 seconds in nanoseconds
          .setMaxWorkerExecuteTimeUnit( TimeUnit.NANOSECONDS )
          .setBlockedThreadCheckInterval( 5000 )
          .setBlockedThreadCheckIntervalUnit( TimeUnit.MILLISECONDS );

      this.vertx      = Vertx.vertx( options );
      this.natsClient = new NatsClient( vertx, config.getData() );
      LOGGER.info( "OrderServiceMain - NatsClient created" );
    }
    catch( Exception e )
    {
      String errMsg = "Error initializing OrderServiceMain: " + e.getMessage();
      LOGGER.error( errMsg, e );
      cleanupResources();
      throw new RuntimeException( errMsg, e );
    }
  }

  public void start()
  {
    LOGGER.info( "Starting Order Consumer Service {}", config.getServiceId() );

    try
    {
      OrderConsumerVert consumerVert = new OrderConsumerVert( natsClient, config );

      String deploymentId = vertx.deployVerticle( consumerVert, new DeploymentOptions() )
                                 .toCompletionStage()
                                 .toCompletableFuture()
                                 .get( DEPLOY_TIMEOUT_SECS, TimeUnit.SECONDS );
      deployedVerticles.add( new ChildVerticle( consumerVert.getClass().getName(), deploymentId ) );

      LOGGER.info( "OrderConsumerVert deployed successfully: {}", deploymentId );
    }
    catch( Exception e )
    {
      LOGGER.error( "Fatal error starting OrderServiceMain: {}", e.getMessage(), e );
      cleanupResources();
      System.exit( 1 );
    }
  }

  /**
   * Undeploy verticles in reverse order, then drain NATS and close Vert.x. Runs on the
   * shutdown hook thread so blocking here is fine.
   */
  void cleanupResources()
  {
    LOGGER.info( "Starting cleanup of resources" );

    List<ChildVerticle> toUndeploy = new ArrayList<>( deployedVerticles );
    for( int i = toUndeploy.size() - 1; i >= 0; i-- )
    {
      ChildVerticle child    = toUndeploy.get( i );
      String        vertInfo = child.vertName() + " with id = " + child.id();

      try
      {
        LOGGER.info( "Undeploying verticle: {}", vertInfo );
        vertx.undeploy( child.id() ).toCompletionStage().toCompletableFuture().get( CLOSE_TIMEOUT_SECS, TimeUnit.SECONDS );
        LOGGER.info( "Successfully undeployed verticle: {}", vertInfo );
      }
      catch( TimeoutException e )
      {
        LOGGER.warn( "Timeout while undeploying verticle {}: {}", vertInfo, e.getMessage() );
      }
      catch( InterruptedException e )
      {
        LOGGER.warn( "Interrupted while undeploying verticle {}: {}", vertInfo, e.getMessage() );
        Thread.currentThread().interrupt();
        break;
      }
      catch( Exception e )
      {
        LOGGER.warn( "Error while undeploying verticle {}: {}", vertInfo, e.getMessage(), e );
      }
    }
    deployedVerticles.clear();

    if( natsClient != null )
    {
      natsClient.cleanup();
      natsClient = null;
    }

    if( vertx != null )
    {
      try
      {
        vertx.close().toCompletionStage().toCompletableFuture().get( CLOSE_TIMEOUT_SECS, TimeUnit.SECONDS );
        LOGGER.info( "Vertx instance closed" );
      }
      catch( InterruptedException e )
      {
        Thread.currentThread().interrupt();
        LOGGER.warn( "Interrupted while closing Vertx instance" );
      }
      catch( Exception e )
      {
        LOGGER.warn( "Error while closing Vertx instance: {}", e.getMessage(), e );
      }
      vertx = null;
    }
  }

  public static void main( String[] args )
  {
    LOGGER.info( "OrderServiceMain.main - Starting Order Consumer Service" );

    final OrderServiceMain service = new OrderServiceMain( OrderServiceConfig.load() );

    Runtime.getRuntime().addShutdownHook( new Thread( () ->
    {
      LOGGER.info( "Shutdown hook triggered - cleaning up resources" );
      service.cleanupResources();
    } ) );

    service.start();
  }
}
