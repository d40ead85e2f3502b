package consumer.router;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.nats.client.Message;
import io.vertx.core.Future;

/**
 * Catch-all for messages the router cannot resolve to a handler.
 */
@FunctionalInterface
public interface FallbackHandler
{
  Future<Void> fallback( Message msg, FallbackReason reason );

  /**
   * Default fallback: log the reason and NAK so the message is redelivered once a handler exists.
   * The returned future succeeds, so a ConsumerRuntime counts the delivery as a success and its
   * follow-up ACK is ignored by the server.
   */
  static FallbackHandler nakAndLog()
  {
    return NakFallback.INSTANCE;
  }

  final class NakFallback implements FallbackHandler
  {
    private static final Logger LOGGER = LoggerFactory.getLogger( NakFallback.class );

    static final NakFallback INSTANCE = new NakFallback();

    private NakFallback()
    {
    }

    @Override
    public Future<Void> fallback( Message msg, FallbackReason reason )
    {
      LOGGER.warn( "Fallback triggered for subject '{}' (reason: {}). NAKing message for redelivery",
                   msg.getSubject(), reason );
      try
      {
        msg.nak();
        return Future.succeededFuture();
      }
      catch( Exception e )
      {
        return Future.failedFuture( e );
      }
    }
  }
}
