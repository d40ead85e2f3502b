package utils;

/**
 * Configuration keys of the order consumer service. The same keys are read from
 * order-consumer.properties and may be overridden by environment variables in upper snake case
 * (natsUrls -> NATS_URLS).
 */
public interface OrderServiceIF
{
  public static final String ServiceId      = "serviceId";
  public static final String DeliveryMode   = "deliveryMode";      // PULL | PUSH
  public static final String AutoCreate     = "autoCreateConsumer";
  public static final String DeadLetter     = "deadLetterEnabled";
  public static final String BatchSize      = "batchSize";
  public static final String FetchTimeoutMs = "fetchTimeoutMs";
  public static final String PullIntervalMs = "pullIntervalMs";
  public static final String WorkerPoolSize = "workerPoolSize";

  public static final String ConfigResource = "order-consumer.properties";
}
