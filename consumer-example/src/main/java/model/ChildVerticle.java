package model;

/**
 * A deployed verticle, kept so it can be undeployed on shutdown.
 */
public record ChildVerticle( String vertName, String id )
{
}
