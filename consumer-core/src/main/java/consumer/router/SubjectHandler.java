package consumer.router;

import io.nats.client.Message;
import io.vertx.core.Future;

/**
 * Application logic for one or more subjects.
 */
@FunctionalInterface
public interface SubjectHandler
{
  /**
   * @return Future that completes when processing is done. A failed future, or an exception
   *         thrown directly, is reported to the caller unchanged.
   */
  Future<Void> handle( Message msg ) throws Exception;
}
