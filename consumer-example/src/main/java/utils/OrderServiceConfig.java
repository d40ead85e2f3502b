package utils;

import java.io.InputStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import consumer.exceptions.ConsumerConfigurationException;
import consumer.nats.NatsConsumerPoolManager.DeliveryMode;
import consumer.nats.NatsClient;
import consumer.runtime.ConsumerConfig;
import consumer.runtime.ConsumerConfigIF;

public class OrderServiceConfig
{
  private static final Logger LOGGER = LoggerFactory.getLogger( OrderServiceConfig.class );

  private String       serviceId      = "order-consumer";
  private DeliveryMode deliveryMode   = DeliveryMode.PUSH;
  private boolean      autoCreate     = true;
  private boolean      deadLetter     = false;
  private int          batchSize      = 10;
  private long         fetchTimeoutMs = 1000;
  private long         pullIntervalMs = 500;
  private int          workerPoolSize = 8;

  private final Map<String, String> data;
  private final ConsumerConfig      consumerConfig;

  public OrderServiceConfig( Map<String, String> data )
  {
    this.data = Collections.unmodifiableMap( new HashMap<>( data ) );

    if( data.get( OrderServiceIF.ServiceId      ) != null ) serviceId      = data.get( OrderServiceIF.ServiceId );
    if( data.get( OrderServiceIF.DeliveryMode   ) != null ) deliveryMode   = parseMode( data.get( OrderServiceIF.DeliveryMode ) );
    if( data.get( OrderServiceIF.AutoCreate     ) != null ) autoCreate     = Boolean.parseBoolean( data.get( OrderServiceIF.AutoCreate ).trim() );
    if( data.get( OrderServiceIF.DeadLetter     ) != null ) deadLetter     = Boolean.parseBoolean( data.get( OrderServiceIF.DeadLetter ).trim() );
    if( data.get( OrderServiceIF.BatchSize      ) != null ) batchSize      = (int) parseNumber( OrderServiceIF.BatchSize );
    if( data.get( OrderServiceIF.FetchTimeoutMs ) != null ) fetchTimeoutMs = parseNumber( OrderServiceIF.FetchTimeoutMs );
    if( data.get( OrderServiceIF.PullIntervalMs ) != null ) pullIntervalMs = parseNumber( OrderServiceIF.PullIntervalMs );
    if( data.get( OrderServiceIF.WorkerPoolSize ) != null ) workerPoolSize = (int) parseNumber( OrderServiceIF.WorkerPoolSize );

    requirePositive( OrderServiceIF.BatchSize,      batchSize      );
    requirePositive( OrderServiceIF.FetchTimeoutMs, fetchTimeoutMs );
    requirePositive( OrderServiceIF.PullIntervalMs, pullIntervalMs );
    requirePositive( OrderServiceIF.WorkerPoolSize, workerPoolSize );

    this.consumerConfig = ConsumerConfig.fromMap( this.data );

    LOGGER.info( "***************** Order Consumer Service Config is set for ******************" );
    LOGGER.info( OrderServiceIF.ServiceId      + "          = " + serviceId      );
    LOGGER.info( NatsClient.NATS_URLS          + "           = " + data.get( NatsClient.NATS_URLS ) );
    LOGGER.info( OrderServiceIF.DeliveryMode   + "       = " + deliveryMode   );
    LOGGER.info( OrderServiceIF.AutoCreate     + " = " + autoCreate     );
    LOGGER.info( OrderServiceIF.DeadLetter     + "  = " + deadLetter     );
    LOGGER.info( "***************** End of Order Consumer Service Config ******************" );
  }

  /**
   * Classpath defaults overlaid with environment variables.
   */
  public static OrderServiceConfig load()
  {
    return new OrderServiceConfig( readSettings( System.getenv() ) );
  }

  static Map<String, String> readSettings( Map<String, String> env )
  {
    Map<String, String> settings = new HashMap<>();

    try( InputStream in = OrderServiceConfig.class.getClassLoader().getResourceAsStream( OrderServiceIF.ConfigResource ) )
    {
      if( in != null )
      {
        Properties props = new Properties();
        props.load( in );
        for( String name : props.stringPropertyNames() )
        {
          settings.put( name, props.getProperty( name ) );
        }
      }
      else
      {
        LOGGER.warn( "{} not found on classpath - using environment only", OrderServiceIF.ConfigResource );
      }
    }
    catch( Exception e )
    {
      throw new ConsumerConfigurationException( "Failed to read " + OrderServiceIF.ConfigResource, e );
    }

    String[] keys = { OrderServiceIF.ServiceId, OrderServiceIF.DeliveryMode, OrderServiceIF.AutoCreate,
                      OrderServiceIF.DeadLetter, OrderServiceIF.BatchSize, OrderServiceIF.FetchTimeoutMs,
                      OrderServiceIF.PullIntervalMs, OrderServiceIF.WorkerPoolSize,
                      NatsClient.NATS_URLS, NatsClient.CONNECTION_NAME, NatsClient.ALLOW_RECONNECT,
                      NatsClient.MAX_RECONNECT_ATTEMPTS, NatsClient.RECONNECT_TIME_WAIT_MS,
                      NatsClient.CONNECT_TIMEOUT_MS, NatsClient.DRAIN_TIMEOUT_MS,
                      ConsumerConfigIF.StreamName, ConsumerConfigIF.Subjects, ConsumerConfigIF.FilterSubject,
                      ConsumerConfigIF.DurableName, ConsumerConfigIF.MaxDeliver, ConsumerConfigIF.ErrorAck };

    for( String key : keys )
    {
      String value = env.get( toEnvName( key ) );
      if( value != null && !value.isBlank() )
        settings.put( key, value );
    }

    return settings;
  }

  /**
   * natsUrls -> NATS_URLS
   */
  static String toEnvName( String key )
  {
    return key.replaceAll( "([a-z0-9])([A-Z])", "$1_$2" ).toUpperCase( Locale.ROOT );
  }

  private static DeliveryMode parseMode( String value )
  {
    try
    {
      return DeliveryMode.valueOf( value.trim().toUpperCase( Locale.ROOT ) );
    }
    catch( IllegalArgumentException e )
    {
      throw new ConsumerConfigurationException( "Unknown delivery mode: " + value, e );
    }
  }

  private static void requirePositive( String key, long value )
  {
    if( value <= 0 )
      throw new ConsumerConfigurationException( key + " must be greater than 0, got " + value );
  }

  private long parseNumber( String key )
  {
    try
    {
      return Long.parseLong( data.get( key ).trim() );
    }
    catch( NumberFormatException e )
    {
      throw new ConsumerConfigurationException( key + " is not a number: " + data.get( key ), e );
    }
  }

  public String              getServiceId()      { return serviceId;      }
  public DeliveryMode        getDeliveryMode()   { return deliveryMode;   }
  public boolean             isAutoCreate()      { return autoCreate;     }
  public boolean             isDeadLetter()      { return deadLetter;     }
  public int                 getBatchSize()      { return batchSize;      }
  public long                getFetchTimeoutMs() { return fetchTimeoutMs; }
  public long                getPullIntervalMs() { return pullIntervalMs; }
  public int                 getWorkerPoolSize() { return workerPoolSize; }
  public ConsumerConfig      getConsumerConfig() { return consumerConfig; }
  public Map<String, String> getData()           { return data;           }
}
