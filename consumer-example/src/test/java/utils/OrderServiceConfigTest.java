package utils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import org.junit.jupiter.api.Test;

import consumer.exceptions.ConsumerConfigurationException;
import consumer.nats.NatsClient;
import consumer.nats.NatsDeadLetterHandler;
import consumer.nats.NatsConsumerPoolManager.DeliveryMode;
import consumer.router.HandlerNames;
import consumer.runtime.ConsumerConfig;
import consumer.runtime.ConsumerConfigIF;
import consumer.runtime.ErrorAckBehavior;

class OrderServiceConfigTest
{
  @Test
  void envNamesAreUpperSnakeCase()
  {
    assertThat( OrderServiceConfig.toEnvName( "natsUrls" ) ).isEqualTo( "NATS_URLS" );
    assertThat( OrderServiceConfig.toEnvName( "maxDeliver" ) ).isEqualTo( "MAX_DELIVER" );
    assertThat( OrderServiceConfig.toEnvName( "errorAckBehavior" ) ).isEqualTo( "ERROR_ACK_BEHAVIOR" );
    assertThat( OrderServiceConfig.toEnvName( "streamName" ) ).isEqualTo( "STREAM_NAME" );
  }

  @Test
  void envNamesIgnoreDefaultLocale()
  {
    Locale saved = Locale.getDefault();
    try
    {
      Locale.setDefault( new Locale( "tr", "TR" ) );

      assertThat( OrderServiceConfig.toEnvName( "serviceId" ) ).isEqualTo( "SERVICE_ID" );
      assertThat( OrderServiceConfig.toEnvName( "pullIntervalMs" ) ).isEqualTo( "PULL_INTERVAL_MS" );

      OrderServiceConfig config = new OrderServiceConfig( OrderServiceConfig.readSettings( Map.of( "SERVICE_ID", "orders-tr" ) ) );
      assertThat( config.getServiceId() ).isEqualTo( "orders-tr" );
      assertThat( ErrorAckBehavior.parse( "delegated" ) ).isEqualTo( ErrorAckBehavior.DELEGATED );
    }
    finally
    {
      Locale.setDefault( saved );
    }
  }

  @Test
  void defaultFilterCoversEveryConfiguredSubject()
  {
    ConsumerConfig consumer = new OrderServiceConfig( OrderServiceConfig.readSettings( Map.of() ) ).getConsumerConfig();

    for( String subject : consumer.getSubjects() )
      assertThat( HandlerNames.subjectMatches( consumer.getFilterSubject(), subject ) ).as( subject ).isTrue();
  }

  @Test
  void deadLetterSubjectsStayOutsideTheSourceSubjects()
  {
    ConsumerConfig consumer = new OrderServiceConfig( OrderServiceConfig.readSettings( Map.of() ) ).getConsumerConfig();

    for( String source : consumer.getSubjects() )
    {
      String dlq = NatsDeadLetterHandler.deadLetterSubject( source );
      for( String subject : consumer.getSubjects() )
        assertThat( HandlerNames.subjectMatches( subject, dlq ) ).as( dlq + " vs " + subject ).isFalse();
    }
  }

  @Test
  void readsClasspathDefaults()
  {
    OrderServiceConfig config = new OrderServiceConfig( OrderServiceConfig.readSettings( Map.of() ) );

    assertThat( config.getServiceId() ).isEqualTo( "order-consumer" );
    assertThat( config.getDeliveryMode() ).isEqualTo( DeliveryMode.PUSH );
    assertThat( config.getConsumerConfig().getStreamName() ).isEqualTo( "orders" );
    assertThat( config.getConsumerConfig().getFilterSubject() ).isEqualTo( ">" );
    assertThat( config.getConsumerConfig().getSubjects() ).contains( "orders.created", "orders-updated", "orders.archived" );
    assertThat( config.getData() ).containsEntry( NatsClient.NATS_URLS, "nats://localhost:4222" );
  }

  @Test
  void environmentOverridesDefaults()
  {
    Map<String, String> env = new HashMap<>();
    env.put( "NATS_URLS",           "nats://nats.prod:4222" );
    env.put( "MAX_DELIVER",         "6" );
    env.put( "ERROR_ACK_BEHAVIOR",  "DELEGATED" );
    env.put( "DELIVERY_MODE",       "pull" );
    env.put( "BATCH_SIZE",          "25" );
    env.put( "DEAD_LETTER_ENABLED", "true" );

    OrderServiceConfig config = new OrderServiceConfig( OrderServiceConfig.readSettings( env ) );

    assertThat( config.getData() ).containsEntry( NatsClient.NATS_URLS, "nats://nats.prod:4222" );
    assertThat( config.getConsumerConfig().getMaxDeliver() ).isEqualTo( 6 );
    assertThat( config.getConsumerConfig().getErrorAckBehavior() ).isEqualTo( ErrorAckBehavior.DELEGATED );
    assertThat( config.getDeliveryMode() ).isEqualTo( DeliveryMode.PULL );
    assertThat( config.getBatchSize() ).isEqualTo( 25 );
    assertThat( config.isDeadLetter() ).isTrue();
  }

  @Test
  void rejectsInvalidValues()
  {
    Map<String, String> data = new HashMap<>();
    data.put( ConsumerConfigIF.StreamName, "orders" );
    data.put( ConsumerConfigIF.Subjects,   "orders.created" );
    data.put( OrderServiceIF.DeliveryMode, "broadcast" );

    assertThatThrownBy( () -> new OrderServiceConfig( data ) ).isInstanceOf( ConsumerConfigurationException.class );

    data.put( OrderServiceIF.DeliveryMode, "push" );
    data.put( OrderServiceIF.BatchSize,    "ten" );

    assertThatThrownBy( () -> new OrderServiceConfig( data ) ).isInstanceOf( ConsumerConfigurationException.class );
  }

  @Test
  void rejectsNonPositivePullSettings()
  {
    Map<String, String> data = new HashMap<>();
    data.put( ConsumerConfigIF.StreamName, "orders" );
    data.put( ConsumerConfigIF.Subjects,   "orders.created" );

    data.put( OrderServiceIF.BatchSize, "0" );
    assertThatThrownBy( () -> new OrderServiceConfig( data ) )
      .isInstanceOf( ConsumerConfigurationException.class )
      .hasMessageContaining( OrderServiceIF.BatchSize );

    data.put( OrderServiceIF.BatchSize,      "10" );
    data.put( OrderServiceIF.PullIntervalMs, "0" );
    assertThatThrownBy( () -> new OrderServiceConfig( data ) )
      .isInstanceOf( ConsumerConfigurationException.class )
      .hasMessageContaining( OrderServiceIF.PullIntervalMs );

    data.put( OrderServiceIF.PullIntervalMs, "500" );
    data.put( OrderServiceIF.FetchTimeoutMs, "-1" );
    assertThatThrownBy( () -> new OrderServiceConfig( data ) )
      .isInstanceOf( ConsumerConfigurationException.class )
      .hasMessageContaining( OrderServiceIF.FetchTimeoutMs );
  }
}
