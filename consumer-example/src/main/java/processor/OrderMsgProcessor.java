package processor;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import consumer.router.SubjectRouter;

import io.nats.client.Message;
import io.vertx.core.Future;
import io.vertx.core.WorkerExecutor;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;

/**
 * Order event handlers. Payloads are JSON objects carrying at least an "id".
 *
 *   orders.created                  -> onCreated
 *   orders.updated, orders-updated  -> onUpdated
 *   orders.deleted, orders_deleted  -> onDeleted
 *   orders.archived                 -> declared, not implemented yet
 *
 * An update for an unknown order fails so the broker redelivers it; the create may still be in
 * flight.
 */
public class OrderMsgProcessor
{
  private static final Logger LOGGER = LoggerFactory.getLogger( OrderMsgProcessor.class );

  public static final String STATUS_CREATED = "CREATED";

  private final WorkerExecutor workerExecutor;

  private final ConcurrentHashMap<String, JsonObject> orders = new ConcurrentHashMap<>();

  public OrderMsgProcessor( WorkerExecutor workerExecutor )
  {
    this.workerExecutor = workerExecutor;
  }

  public SubjectRouter buildRouter()
  {
    return SubjectRouter.builder()
      .on( this::onCreated, "orders.created" )
      .on( this::onUpdated, "orders.updated", "orders-updated" )
      .on( this::onDeleted, "orders.deleted", "orders_deleted" )
      .expect( "orders.archived" )
      .build();
  }

  public Future<Void> onCreated( Message msg )
  {
    return workerExecutor.executeBlocking( () -> {
      JsonObject order = decode( msg );
      String     id    = orderId( order );

      order.put( "status", STATUS_CREATED );
      JsonObject previous = orders.putIfAbsent( id, order );
      if( previous != null )
      {
        LOGGER.info( "Order {} already exists - duplicate create ignored", id );
        return null;
      }

      LOGGER.info( "Order created: {}", id );
      return null;
    }, false );
  }

  public Future<Void> onUpdated( Message msg )
  {
    return workerExecutor.executeBlocking( () -> {
      JsonObject update = decode( msg );
      String     id     = orderId( update );

      JsonObject merged = orders.computeIfPresent( id, ( k, existing ) -> existing.copy().mergeIn( update ) );
      if( merged == null )
        throw new IllegalStateException( "Update for unknown order " + id );

      LOGGER.info( "Order updated: {} via {}", id, msg.getSubject() );
      return null;
    }, false );
  }

  public Future<Void> onDeleted( Message msg )
  {
    return workerExecutor.executeBlocking( () -> {
      String id = orderId( decode( msg ) );

      if( orders.remove( id ) == null )
        LOGGER.info( "Delete for unknown order {} - nothing to do", id );
      else
        LOGGER.info( "Order deleted: {}", id );

      return null;
    }, false );
  }

  private static JsonObject decode( Message msg )
  {
    byte[] data = msg.getData();
    if( data == null || data.length == 0 )
      throw new IllegalArgumentException( "Empty order payload on " + msg.getSubject() );

    try
    {
      return new JsonObject( new String( data, StandardCharsets.UTF_8 ) );
    }
    catch( DecodeException e )
    {
      throw new IllegalArgumentException( "Malformed order payload on " + msg.getSubject(), e );
    }
  }

  private static String orderId( JsonObject order )
  {
    Object id = order.getValue( "id" );
    if( id == null )
      throw new IllegalArgumentException( "Order payload has no id" );

    return id.toString();
  }

  public Map<String, JsonObject> getOrders()
  {
    return new HashMap<>( orders );
  }
}
