package processor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import consumer.router.FallbackReason;
import consumer.router.SubjectRouter;
import consumer.runtime.ConsumerConfig;
import consumer.runtime.ConsumerRuntime;
import consumer.runtime.DeliveryOutcome;

import io.nats.client.Message;
import io.nats.client.impl.NatsJetStreamMetaData;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;

class OrderMsgProcessorTest
{
  private Vertx             vertx;
  private WorkerExecutor    workerExecutor;
  private OrderMsgProcessor processor;
  private SubjectRouter     router;

  @BeforeEach
  void setUp()
  {
    vertx          = Vertx.vertx();
    workerExecutor = vertx.createSharedWorkerExecutor( "order-test", 2 );
    processor      = new OrderMsgProcessor( workerExecutor );
    router         = processor.buildRouter();
  }

  @AfterEach
  void tearDown() throws Exception
  {
    workerExecutor.close();
    vertx.close().toCompletionStage().toCompletableFuture().get( 5, TimeUnit.SECONDS );
  }

  private static Message message( String subject, String json, long attempt )
  {
    NatsJetStreamMetaData metaData = mock( NatsJetStreamMetaData.class );
    when( metaData.deliveredCount() ).thenReturn( attempt );

    Message msg = mock( Message.class );
    when( msg.getSubject() ).thenReturn( subject );
    when( msg.getData() ).thenReturn( json == null ? null : json.getBytes( StandardCharsets.UTF_8 ) );
    when( msg.metaData() ).thenReturn( metaData );
    return msg;
  }

  private static <T> T await( Future<T> future ) throws Exception
  {
    return future.toCompletionStage().toCompletableFuture().get( 5, TimeUnit.SECONDS );
  }

  private static Throwable failure( Future<?> future ) throws Exception
  {
    try
    {
      await( future );
      return null;
    }
    catch( ExecutionException e )
    {
      return e.getCause();
    }
  }

  @Test
  void routesOrderLifecycle() throws Exception
  {
    await( router.handle( message( "orders.created", "{\"id\":\"o-1\",\"total\":10}", 1 ) ) );
    await( router.handle( message( "orders-updated", "{\"id\":\"o-1\",\"total\":12}", 1 ) ) );

    assertThat( processor.getOrders() ).containsKey( "o-1" );
    assertThat( processor.getOrders().get( "o-1" ).getInteger( "total" ) ).isEqualTo( 12 );
    assertThat( processor.getOrders().get( "o-1" ).getString( "status" ) ).isEqualTo( OrderMsgProcessor.STATUS_CREATED );

    await( router.handle( message( "orders_deleted", "{\"id\":\"o-1\"}", 1 ) ) );

    assertThat( processor.getOrders() ).isEmpty();
  }

  @Test
  void collidingSubjectsShareHandler()
  {
    assertThat( router.getCollisions() ).containsKeys( "updated", "deleted" );
    assertThat( router.getHandlerMap().get( "orders.updated" ).getHandler() )
      .isSameAs( router.getHandlerMap().get( "orders-updated" ).getHandler() );
  }

  @Test
  void archivedIsDeclaredButNotImplemented()
  {
    assertThat( router.getMissingHandlers() ).containsExactly( "orders.archived" );
    assertThat( router.getHandlerIds() ).contains( "archived" );
  }

  @Test
  void unknownSubjectIsNakedByFallback() throws Exception
  {
    Message msg = message( "orders.shipped", "{\"id\":\"o-1\"}", 1 );

    await( router.handle( msg ) );

    verify( msg ).nak();
    assertThat( FallbackReason.UNHANDLED_SUBJECT.getCode() ).isEqualTo( "unhandled_subject" );
  }

  @Test
  void updateForUnknownOrderFails() throws Exception
  {
    Throwable cause = failure( router.handle( message( "orders.updated", "{\"id\":\"o-9\"}", 1 ) ) );

    assertThat( cause ).isInstanceOf( IllegalStateException.class ).hasMessageContaining( "o-9" );
  }

  @Test
  void malformedPayloadsFail() throws Exception
  {
    assertThat( failure( router.handle( message( "orders.created", "not json", 1 ) ) ) ).isInstanceOf( IllegalArgumentException.class );
    assertThat( failure( router.handle( message( "orders.created", null, 1 ) ) ) ).isInstanceOf( IllegalArgumentException.class );
    assertThat( failure( router.handle( message( "orders.created", "{\"total\":1}", 1 ) ) ) ).isInstanceOf( IllegalArgumentException.class );
  }

  @Test
  void runtimeRetriesUpdateUntilCreateArrives() throws Exception
  {
    ConsumerConfig config = ConsumerConfig.builder()
      .streamName( "orders" )
      .subjects( "orders.created", "orders.updated" )
      .durableName( "order-consumer" )
      .maxDeliver( 3 )
      .build();
    ConsumerRuntime runtime = new ConsumerRuntime( config, router::handle );

    Message early = message( "orders.updated", "{\"id\":\"o-2\",\"total\":5}", 1 );
    assertThat( await( runtime.processMessage( early ) ) ).isEqualTo( DeliveryOutcome.TRANSIENT_FAILURE );
    verify( early ).nak();

    assertThat( await( runtime.processMessage( message( "orders.created", "{\"id\":\"o-2\",\"total\":4}", 1 ) ) ) )
      .isEqualTo( DeliveryOutcome.SUCCESS );

    Message redelivered = message( "orders.updated", "{\"id\":\"o-2\",\"total\":5}", 2 );
    assertThat( await( runtime.processMessage( redelivered ) ) ).isEqualTo( DeliveryOutcome.SUCCESS );
    verify( redelivered ).ack();
    verify( redelivered, never() ).nak();

    assertThat( runtime.getTotalSuccessCount() ).isEqualTo( 2 );
    assertThat( runtime.getTotalErrorCount() ).isZero();
    assertThat( processor.getOrders().get( "o-2" ).getInteger( "total" ) ).isEqualTo( 5 );
  }
}
