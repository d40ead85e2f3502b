package consumer.nats;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import consumer.exceptions.ConsumerConfigurationException;

import io.nats.client.Options;

class NatsClientOptionsTest
{
  @Test
  void buildsServersAndReconnectSettings()
  {
    Map<String, String> config = new HashMap<>();
    config.put( NatsClient.NATS_URLS,              "nats://a:4222, nats://b:4222" );
    config.put( NatsClient.MAX_RECONNECT_ATTEMPTS, "7" );
    config.put( NatsClient.RECONNECT_TIME_WAIT_MS, "250" );
    config.put( NatsClient.CONNECTION_NAME,        "order-consumer" );

    Options options = NatsClient.buildOptions( config, null, null );

    assertThat( options.getServers() ).hasSize( 2 );
    assertThat( options.getMaxReconnect() ).isEqualTo( 7 );
    assertThat( options.getReconnectWait() ).isEqualTo( Duration.ofMillis( 250 ) );
    assertThat( options.getConnectionName() ).isEqualTo( "order-consumer" );
  }

  @Test
  void appliesDefaults()
  {
    Options options = NatsClient.buildOptions( Map.of( NatsClient.NATS_URLS, "nats://localhost:4222" ), null, null );

    assertThat( options.getMaxReconnect() ).isEqualTo( 5 );
    assertThat( options.getReconnectWait() ).isEqualTo( Duration.ofMillis( 1000 ) );
  }

  @Test
  void reconnectCanBeDisabled()
  {
    Options options = NatsClient.buildOptions( Map.of( NatsClient.NATS_URLS,       "nats://localhost:4222",
                                                       NatsClient.ALLOW_RECONNECT, "false" ), null, null );

    assertThat( options.getMaxReconnect() ).isZero();
  }

  @Test
  void rejectsMissingUrls()
  {
    assertThatThrownBy( () -> NatsClient.buildOptions( Map.of( NatsClient.CONNECTION_NAME, "x" ), null, null ) )
      .isInstanceOf( ConsumerConfigurationException.class );
    assertThatThrownBy( () -> NatsClient.buildOptions( Map.of( NatsClient.NATS_URLS, " , " ), null, null ) )
      .isInstanceOf( ConsumerConfigurationException.class );
  }

  @Test
  void rejectsNonNumericSettings()
  {
    assertThatThrownBy( () -> NatsClient.buildOptions( Map.of( NatsClient.NATS_URLS,              "nats://localhost:4222",
                                                               NatsClient.MAX_RECONNECT_ATTEMPTS, "many" ), null, null ) )
      .isInstanceOf( ConsumerConfigurationException.class );
  }
}
