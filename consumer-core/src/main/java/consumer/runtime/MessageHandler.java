package consumer.runtime;

import io.nats.client.Message;
import io.vertx.core.Future;

/**
 * Business logic for a consumer. Commonly a SubjectRouter::handle reference.
 */
@FunctionalInterface
public interface MessageHandler
{
  /**
   * @return Future that completes when processing is done (success = ack, failure = retry or terminal handling)
   */
  Future<Void> handleMessage( Message msg ) throws Exception;
}
