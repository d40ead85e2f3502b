package consumer.router;

/**
 * Why a message could not be routed to a handler.
 */
public enum FallbackReason
{
  /** Subject is not one the router was built for. */
  UNHANDLED_SUBJECT( "unhandled_subject" ),

  /** Subject was declared but has no mapping, e.g. a wildcard literal. */
  NO_MAPPING( "no_mapping" ),

  /** Subject is mapped but no handler was implemented for it. */
  NOT_IMPLEMENTED( "not_implemented" );

  private final String code;

  FallbackReason( String code )
  {
    this.code = code;
  }

  public String getCode() { return code; }

  @Override
  public String toString()
  {
    return code;
  }
}
