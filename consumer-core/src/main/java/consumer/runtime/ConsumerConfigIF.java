package consumer.runtime;

/**
 * Configuration keys read by ConsumerConfig.fromMap().
 */
public interface ConsumerConfigIF
{
  public static final String StreamName       = "streamName";
  public static final String Subjects         = "subjects";          // comma separated
  public static final String FilterSubject    = "filterSubject";
  public static final String DurableName      = "durableName";
  public static final String MaxDeliver       = "maxDeliver";
  public static final String ErrorAck         = "errorAckBehavior";  // NAK | ACK | DELEGATED

  public static final String DefaultDurableName  = "default";
  public static final String DeliverSubjectSuffix = ".deliver";
  public static final int    DefaultMaxDeliver    = 3;
}
