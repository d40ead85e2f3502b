package consumer.runtime;

import io.nats.client.Message;
import io.vertx.core.Future;

/**
 * Called once when a message fails on its final delivery attempt, before the configured
 * ErrorAckBehavior is applied. Failures raised here are not caught by the runtime.
 */
@FunctionalInterface
public interface ConsumerErrorHandler
{
  Future<Void> handleError( Message msg, Throwable error, long attemptCount ) throws Exception;

  static ConsumerErrorHandler noop()
  {
    return ( msg, error, attemptCount ) -> Future.succeededFuture();
  }
}
