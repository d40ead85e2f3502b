package consumer.router;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import consumer.exceptions.ConsumerConfigurationException;

import io.nats.client.Message;
import io.vertx.core.Future;

/**
 * Routes messages to handlers by subject.
 *
 * The subject to handler table is built once from explicit registrations and never changes
 * afterwards. Registering the same subject twice keeps the later handler. Distinct subjects that
 * derive the same handler id (e.g. 'orders.updated' and 'orders-updated') are reported as
 * collisions but both stay routable.
 *
 * Wildcard subjects ('orders.*', 'users.>') may be declared but are never auto-routed.
 *
 * <pre>
 *   SubjectRouter router = SubjectRouter.builder()
 *     .on( this::onCreated, "orders.created" )
 *     .on( this::onUpdated, "orders.updated", "orders-updated" )
 *     .expect( "orders.archived" )
 *     .build();
 * </pre>
 */
public class SubjectRouter
{
  private static final Logger LOGGER = LoggerFactory.getLogger( SubjectRouter.class );

  private final List<String>          subjects;
  private final Map<String, Route>    handlerMap;
  private final Map<String, Set<String>> collisions;
  private final FallbackHandler       fallbackHandler;

  /**
   * One entry of the handler table. Handler is null for subjects declared with expect().
   */
  public static final class Route
  {
    private final String         subject;
    private final String         handlerId;
    private final SubjectHandler handler;

    Route( String subject, String handlerId, SubjectHandler handler )
    {
      this.subject   = subject;
      this.handlerId = handlerId;
      this.handler   = handler;
    }

    public String         getSubject()   { return subject;   }
    public String         getHandlerId() { return handlerId; }
    public SubjectHandler getHandler()   { return handler;   }
    public boolean        isImplemented() { return handler != null; }

    @Override
    public String toString()
    {
      return subject + " -> " + handlerId + ( handler == null ? " (not implemented)" : "" );
    }
  }

  private SubjectRouter( Builder builder )
  {
    this.subjects        = Collections.unmodifiableList( new ArrayList<>( builder.registrations.keySet() ) );
    this.fallbackHandler = builder.fallbackHandler;

    Map<String, Route>       map       = new LinkedHashMap<>();
    Map<String, Set<String>> byId      = new LinkedHashMap<>();
    Map<String, Set<String>> collided  = new LinkedHashMap<>();

    for( Map.Entry<String, SubjectHandler> entry : builder.registrations.entrySet() )
    {
      String subject = entry.getKey();
      if( HandlerNames.isWildcard( subject ) )
      {
        LOGGER.debug( "Wildcard subject '{}' is not auto-routed", subject );
        continue;
      }

      String      handlerId = HandlerNames.deriveHandlerId( subject );
      Set<String> sameId    = byId.computeIfAbsent( handlerId, k -> new LinkedHashSet<>() );

      if( !sameId.isEmpty() )
      {
        LOGGER.warn( "Handler id collision: '{}' and {} both map to '{}'. Consider dot notation for subjects (e.g. 'orders.created' instead of 'orders-created')",
                     subject, sameId, handlerId );
        collided.computeIfAbsent( handlerId, k -> new LinkedHashSet<>( sameId ) ).add( subject );
      }
      sameId.add( subject );

      map.put( subject, new Route( subject, handlerId, entry.getValue() ) );
    }

    List<String> nonDot = new ArrayList<>();
    for( String subject : subjects )
    {
      if( !HandlerNames.isWildcard( subject ) && !HandlerNames.usesDotNotation( subject ) )
        nonDot.add( subject );
    }
    if( !nonDot.isEmpty() )
    {
      LOGGER.info( "RECOMMENDATION: Consider using dot notation for subjects: {}. Example: 'orders.created' instead of 'orders-created' or 'orders_created'", nonDot );
    }

    for( Map.Entry<String, Set<String>> entry : collided.entrySet() )
    {
      entry.setValue( Collections.unmodifiableSet( entry.getValue() ) );
    }

    this.handlerMap = Collections.unmodifiableMap( map );
    this.collisions = Collections.unmodifiableMap( collided );

    LOGGER.info( "SubjectRouter built: {} subjects, {} routes, {} collisions", subjects.size(), handlerMap.size(), collisions.size() );
  }

  public static Builder builder()
  {
    return new Builder();
  }

  /**
   * Route the message to its handler. Routing failures go to the fallback handler; handler
   * failures are returned unchanged and never reach the fallback. No ack is sent on success.
   */
  public Future<Void> handle( Message msg )
  {
    String subject = msg.getSubject();
    Route  route   = subject == null ? null : handlerMap.get( subject );

    if( route == null )
    {
      if( subject != null && subjects.contains( subject ) )
      {
        LOGGER.warn( "No handler mapping found for subject: {}", subject );
        return fallbackHandler.fallback( msg, FallbackReason.NO_MAPPING );
      }

      LOGGER.warn( "Received message for unhandled subject: {}", subject );
      return fallbackHandler.fallback( msg, FallbackReason.UNHANDLED_SUBJECT );
    }

    if( !route.isImplemented() )
    {
      LOGGER.error( "Handler '{}' not implemented for subject '{}'", route.getHandlerId(), subject );
      return fallbackHandler.fallback( msg, FallbackReason.NOT_IMPLEMENTED );
    }

    Future<Void> result;
    try
    {
      result = route.getHandler().handle( msg );
      if( result == null )
        result = Future.succeededFuture();
    }
    catch( Exception e )
    {
      result = Future.failedFuture( e );
    }

    return result.onFailure( err ->
      LOGGER.error( "Error in handler '{}' for subject '{}': {}", route.getHandlerId(), subject, err.getMessage() ) );
  }

  /**
   * Expected handler ids in registration order, one per routable subject.
   */
  public List<String> getHandlerIds()
  {
    List<String> ids = new ArrayList<>( handlerMap.size() );
    for( Route route : handlerMap.values() )
    {
      ids.add( route.getHandlerId() );
    }
    return ids;
  }

  /**
   * Subjects that are mapped but have no implemented handler. Used for startup self checks.
   */
  public List<String> getMissingHandlers()
  {
    List<String> missing = new ArrayList<>();
    for( Route route : handlerMap.values() )
    {
      if( !route.isImplemented() )
        missing.add( route.getSubject() );
    }
    return missing;
  }

  /** All declared subjects, wildcards included, in registration order. */
  public List<String>             getSubjects()        { return subjects;        }
  public Map<String, Route>       getHandlerMap()      { return handlerMap;      }
  public Map<String, Set<String>> getCollisions()      { return collisions;      }
  public FallbackHandler          getFallbackHandler() { return fallbackHandler; }

  public static class Builder
  {
    private final LinkedHashMap<String, SubjectHandler> registrations = new LinkedHashMap<>();

    private FallbackHandler fallbackHandler = FallbackHandler.nakAndLog();

    private Builder()
    {
    }

    /**
     * Register a handler for one or more subjects. A subject registered again keeps the latest
     * handler but its original position.
     */
    public Builder on( SubjectHandler handler, String... subjects )
    {
      if( handler == null )
        throw new ConsumerConfigurationException( "Handler must not be null" );

      return register( handler, subjects );
    }

    /**
     * Declare subjects that are received but not implemented yet. Messages on them go to the
     * fallback with reason NOT_IMPLEMENTED.
     */
    public Builder expect( String... subjects )
    {
      return register( null, subjects );
    }

    public Builder fallback( FallbackHandler fallbackHandler )
    {
      if( fallbackHandler == null )
        throw new ConsumerConfigurationException( "Fallback handler must not be null" );

      this.fallbackHandler = fallbackHandler;
      return this;
    }

    public SubjectRouter build()
    {
      if( registrations.isEmpty() )
        throw new ConsumerConfigurationException( "SubjectRouter requires at least one subject registration" );

      return new SubjectRouter( this );
    }

    private Builder register( SubjectHandler handler, String... subjects )
    {
      if( subjects == null || subjects.length == 0 )
        throw new ConsumerConfigurationException( "At least one subject is required per registration" );

      for( String subject : subjects )
      {
        if( subject == null || subject.isBlank() )
          throw new ConsumerConfigurationException( "Subject must not be blank" );

        SubjectHandler previous = registrations.put( subject, handler );
        if( previous != null && previous != handler )
        {
          LOGGER.warn( "Subject '{}' registered more than once - last registration wins", subject );
        }
      }
      return this;
    }
  }
}
