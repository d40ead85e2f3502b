package consumer.nats;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import consumer.exceptions.ConsumerConfigurationException;

import io.nats.client.Connection;
import io.nats.client.ConnectionListener;
import io.nats.client.ErrorListener;
import io.nats.client.Nats;
import io.nats.client.Options;
import io.vertx.core.Vertx;

/**
 * NATS connection shared by all consumers of a process.
 *
 * Settings come from a flat key/value map:
 * <pre>
 *   natsUrls              comma separated server urls (required)
 *   connectionName        client name shown by the server (optional)
 *   allowReconnect        default true
 *   maxReconnectAttempts  default 5
 *   reconnectTimeWaitMs   default 1000
 *   connectTimeoutMs      optional, client default otherwise
 *   drainTimeoutMs        default 30000, used by cleanup()
 * </pre>
 */
public class NatsClient
{
  private static final Logger LOGGER = LoggerFactory.getLogger( NatsClient.class );

  public static final String NATS_URLS              = "natsUrls";
  public static final String CONNECTION_NAME        = "connectionName";
  public static final String ALLOW_RECONNECT        = "allowReconnect";
  public static final String MAX_RECONNECT_ATTEMPTS = "maxReconnectAttempts";
  public static final String RECONNECT_TIME_WAIT_MS = "reconnectTimeWaitMs";
  public static final String CONNECT_TIMEOUT_MS     = "connectTimeoutMs";
  public static final String DRAIN_TIMEOUT_MS       = "drainTimeoutMs";

  private static final int  DEFAULT_MAX_RECONNECTS    = 5;
  private static final long DEFAULT_RECONNECT_WAIT_MS = 1000;
  private static final long DEFAULT_DRAIN_TIMEOUT_MS  = 30000;

  private static final int  MAX_CONNECT_ATTEMPTS = 3;
  private static final long RETRY_DELAY_MS       = 2000;

  private final Vertx               vertx;
  private final Options             options;
  private final long                drainTimeoutMs;
  private volatile Connection       natsConnection;
  private NatsConsumerPoolManager   consumerPoolManager;

  public NatsClient( Vertx vertx, Map<String, String> config ) throws Exception
  {
    if( config == null || config.isEmpty() )
      throw new ConsumerConfigurationException( "NATS config cannot be null or empty" );

    this.vertx          = vertx;
    this.options        = buildOptions( config, this::handleConnectionEvent, new LoggingErrorListener() );
    this.drainTimeoutMs = parseLong( config, DRAIN_TIMEOUT_MS, DEFAULT_DRAIN_TIMEOUT_MS );

    LOGGER.info( "*** NATS urls = {}; maxReconnect = {}; reconnectWait = {}",
                 config.get( NATS_URLS ), options.getMaxReconnect(), options.getReconnectWait() );

    this.natsConnection      = connectWithRetry();
    this.consumerPoolManager = new NatsConsumerPoolManager( vertx, this );

    LOGGER.info( "NATS client initialized" );
  }

  /**
   * Translate the flat settings into jnats Options.
   */
  public static Options buildOptions( Map<String, String> config, ConnectionListener connectionListener, ErrorListener errorListener )
  {
    String urls = config.get( NATS_URLS );
    if( urls == null || urls.isBlank() )
      throw new ConsumerConfigurationException( NATS_URLS + " must be set" );

    List<String> servers = new ArrayList<>();
    for( String url : urls.split( "," ) )
    {
      if( !url.isBlank() )
        servers.add( url.trim() );
    }
    if( servers.isEmpty() )
      throw new ConsumerConfigurationException( NATS_URLS + " contains no server url: " + urls );

    Options.Builder builder = new Options.Builder().servers( servers.toArray( new String[0] ) );

    String allowReconnect = config.get( ALLOW_RECONNECT );
    if( allowReconnect != null && !Boolean.parseBoolean( allowReconnect.trim() ) )
    {
      builder.noReconnect();
    }
    else
    {
      builder.maxReconnects( (int) parseLong( config, MAX_RECONNECT_ATTEMPTS, DEFAULT_MAX_RECONNECTS ) )
             .reconnectWait( Duration.ofMillis( parseLong( config, RECONNECT_TIME_WAIT_MS, DEFAULT_RECONNECT_WAIT_MS ) ) );
    }

    if( config.get( CONNECT_TIMEOUT_MS ) != null )
      builder.connectionTimeout( Duration.ofMillis( parseLong( config, CONNECT_TIMEOUT_MS, 0 ) ) );

    if( config.get( CONNECTION_NAME ) != null )
      builder.connectionName( config.get( CONNECTION_NAME ) );

    if( connectionListener != null )
      builder.connectionListener( connectionListener );

    if( errorListener != null )
      builder.errorListener( errorListener );

    return builder.build();
  }

  private static long parseLong( Map<String, String> config, String key, long defaultValue )
  {
    String value = config.get( key );
    if( value == null || value.isBlank() )
      return defaultValue;

    try
    {
      return Long.parseLong( value.trim() );
    }
    catch( NumberFormatException e )
    {
      throw new ConsumerConfigurationException( key + " is not a number: " + value, e );
    }
  }

  private Connection connectWithRetry() throws Exception
  {
    for( int attempt = 1; attempt <= MAX_CONNECT_ATTEMPTS; attempt++ )
    {
      try
      {
        Connection conn = Nats.connect( options );
        LOGGER.info( "NATS connection established url={} identity={}", conn.getConnectedUrl(), System.identityHashCode( conn ) );
        return conn;
      }
      catch( Exception e )
      {
        LOGGER.error( "Error building NATS connection (attempt {}/{}): {}", attempt, MAX_CONNECT_ATTEMPTS, e.getMessage(), e );

        if( attempt == MAX_CONNECT_ATTEMPTS )
          throw new Exception( "Failed to build NATS connection after " + MAX_CONNECT_ATTEMPTS + " attempts", e );

        Thread.sleep( RETRY_DELAY_MS );
      }
    }

    throw new IllegalStateException( "unreachable" );
  }

  private void handleConnectionEvent( Connection conn, ConnectionListener.Events type )
  {
    if( type == null )
      return;

    switch( type )
    {
      case CONNECTED:
      case RECONNECTED:
      case RESUBSCRIBED:
        LOGGER.info( "NATS {} connRef={}", type, System.identityHashCode( conn ) );
        break;
      case DISCONNECTED:
        LOGGER.warn( "NATS DISCONNECTED connRef={} - in-flight acks may fail until reconnect", System.identityHashCode( conn ) );
        break;
      case CLOSED:
        LOGGER.info( "NATS connection closed connRef={}", System.identityHashCode( conn ) );
        break;
      default:
        LOGGER.debug( "NATS connection event {} connRef={}", type, System.identityHashCode( conn ) );
    }
  }

  private static class LoggingErrorListener implements ErrorListener
  {
    @Override
    public void errorOccurred( Connection conn, String error )
    {
      LOGGER.warn( "NATS error: {}", error );
    }

    @Override
    public void exceptionOccurred( Connection conn, Exception exp )
    {
      LOGGER.error( "NATS exception: {}", exp == null ? "null" : exp.getMessage(), exp );
    }
  }

  public Connection getConnectionForNewOperations()
  {
    return natsConnection;
  }

  public NatsConsumerPoolManager getConsumerPoolManager()
  {
    return consumerPoolManager;
  }

  public Vertx getVertx()
  {
    return vertx;
  }

  public boolean isHealthy()
  {
    try
    {
      return natsConnection != null && natsConnection.getStatus() == Connection.Status.CONNECTED;
    }
    catch( Exception e )
    {
      return false;
    }
  }

  /**
   * Stop all consumers, then drain and close the connection. Outstanding handler executions
   * should be finished by the caller before this runs.
   */
  public void cleanup()
  {
    try
    {
      if( consumerPoolManager != null )
      {
        consumerPoolManager.shutdown();
      }
      if( natsConnection != null && natsConnection.getStatus() != Connection.Status.CLOSED )
      {
        boolean drained = natsConnection.drain( Duration.ofMillis( drainTimeoutMs ) ).get( drainTimeoutMs + 1000, TimeUnit.MILLISECONDS );
        if( !drained )
        {
          LOGGER.warn( "NATS drain did not complete within {}ms - closing", drainTimeoutMs );
          natsConnection.close();
        }
      }
    }
    catch( InterruptedException e )
    {
      Thread.currentThread().interrupt();
      LOGGER.warn( "Interrupted while draining NATS connection" );
    }
    catch( Exception e )
    {
      LOGGER.error( "Error during cleanup: {}", e.getMessage(), e );
    }

    LOGGER.info( "NatsClient cleanup successful" );
  }
}
