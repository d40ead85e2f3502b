package consumer.router;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Derives handler identifiers from subjects.
 *
 * Separators '.', '-' and '_' are treated alike. For multi-token subjects the first token is
 * the namespace and is dropped; single-token subjects keep their token. Empty tokens are kept,
 * so doubled or trailing separators stay visible in the id:
 *
 *   orders.created      -> created
 *   orders-created      -> created
 *   orders_old_deleted  -> old_deleted
 *   orders..created     -> _created
 *   orders.             -> (empty id)
 *   payments            -> payments
 */
public final class HandlerNames
{
  public static final String ID_DELIMITER = "_";

  private HandlerNames()
  {
  }

  public static boolean isWildcard( String subject )
  {
    return subject.indexOf( '*' ) >= 0 || subject.indexOf( '>' ) >= 0;
  }

  public static boolean usesDotNotation( String subject )
  {
    return subject.indexOf( '.' ) >= 0;
  }

  /**
   * Unify separators and split into tokens, empty ones included.
   */
  public static List<String> tokenize( String subject )
  {
    String unified = subject.replace( '-', '.' ).replace( '_', '.' );

    return new ArrayList<>( Arrays.asList( unified.split( "\\.", -1 ) ) );
  }

  /**
   * @throws IllegalArgumentException for wildcard or blank subjects, which have no handler id
   */
  public static String deriveHandlerId( String subject )
  {
    if( subject == null || subject.isBlank() )
      throw new IllegalArgumentException( "Subject must not be blank" );

    if( isWildcard( subject ) )
      throw new IllegalArgumentException( "Wildcard subject has no handler id: " + subject );

    List<String> tokens = tokenize( subject );
    if( tokens.size() == 1 )
      return tokens.get( 0 );

    return String.join( ID_DELIMITER, tokens.subList( 1, tokens.size() ) );
  }

  /**
   * NATS subject matching: '*' matches exactly one token, a trailing '>' matches one or more.
   */
  public static boolean subjectMatches( String filter, String subject )
  {
    if( filter == null || subject == null || filter.isEmpty() || subject.isEmpty() )
      return false;

    String[] f = filter.split( "\\.", -1 );
    String[] s = subject.split( "\\.", -1 );

    for( int i = 0; i < f.length; i++ )
    {
      if( ">".equals( f[i] ) && i == f.length - 1 )
        return s.length > i;

      if( i >= s.length )
        return false;

      if( !"*".equals( f[i] ) && !f[i].equals( s[i] ) )
        return false;
    }

    return f.length == s.length;
  }
}
