package consumer.router;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class HandlerNamesTest
{
  @Test
  void dropsNamespaceToken()
  {
    assertThat( HandlerNames.deriveHandlerId( "orders.created" ) ).isEqualTo( "created" );
    assertThat( HandlerNames.deriveHandlerId( "users.profile.updated" ) ).isEqualTo( "profile_updated" );
  }

  @Test
  void treatsDashAndUnderscoreLikeDot()
  {
    assertThat( HandlerNames.deriveHandlerId( "orders-created" ) ).isEqualTo( "created" );
    assertThat( HandlerNames.deriveHandlerId( "orders_old_deleted" ) ).isEqualTo( "old_deleted" );
    assertThat( HandlerNames.deriveHandlerId( "orders.bulk-import" ) ).isEqualTo( "bulk_import" );
  }

  @Test
  void singleTokenSubjectKeepsItsToken()
  {
    assertThat( HandlerNames.deriveHandlerId( "payments" ) ).isEqualTo( "payments" );
  }

  @Test
  void emptyTokensAreKept()
  {
    assertThat( HandlerNames.tokenize( "orders..created" ) ).containsExactly( "orders", "", "created" );
    assertThat( HandlerNames.deriveHandlerId( "orders..created" ) ).isEqualTo( "_created" );
    assertThat( HandlerNames.deriveHandlerId( "orders.-created" ) ).isEqualTo( "_created" );
    assertThat( HandlerNames.deriveHandlerId( "orders." ) ).isEmpty();
    assertThat( HandlerNames.deriveHandlerId( ".created" ) ).isEqualTo( "created" );
    assertThat( HandlerNames.deriveHandlerId( "..." ) ).isEqualTo( "__" );
  }

  @Test
  void doubledSeparatorDoesNotCollideWithSingleSeparator()
  {
    assertThat( HandlerNames.deriveHandlerId( "orders..created" ) )
      .isNotEqualTo( HandlerNames.deriveHandlerId( "orders.created" ) );
  }

  @Test
  void wildcardAndBlankSubjectsHaveNoHandlerId()
  {
    assertThatThrownBy( () -> HandlerNames.deriveHandlerId( "orders.*" ) ).isInstanceOf( IllegalArgumentException.class );
    assertThatThrownBy( () -> HandlerNames.deriveHandlerId( "users.>" ) ).isInstanceOf( IllegalArgumentException.class );
    assertThatThrownBy( () -> HandlerNames.deriveHandlerId( " " ) ).isInstanceOf( IllegalArgumentException.class );
    assertThatThrownBy( () -> HandlerNames.deriveHandlerId( null ) ).isInstanceOf( IllegalArgumentException.class );
  }

  @Test
  void detectsWildcardsAndDotNotation()
  {
    assertThat( HandlerNames.isWildcard( "orders.*" ) ).isTrue();
    assertThat( HandlerNames.isWildcard( "orders.>" ) ).isTrue();
    assertThat( HandlerNames.isWildcard( "orders.created" ) ).isFalse();

    assertThat( HandlerNames.usesDotNotation( "orders.created" ) ).isTrue();
    assertThat( HandlerNames.usesDotNotation( "orders-created" ) ).isFalse();
  }

  @Test
  void matchesSubjectsWithNatsWildcards()
  {
    assertThat( HandlerNames.subjectMatches( "orders.>", "orders.created" ) ).isTrue();
    assertThat( HandlerNames.subjectMatches( "orders.>", "orders.bulk.import" ) ).isTrue();
    assertThat( HandlerNames.subjectMatches( "orders.>", "orders" ) ).isFalse();
    assertThat( HandlerNames.subjectMatches( "orders.>", "orders-updated" ) ).isFalse();
    assertThat( HandlerNames.subjectMatches( "orders.*", "orders.created" ) ).isTrue();
    assertThat( HandlerNames.subjectMatches( "orders.*", "orders.bulk.import" ) ).isFalse();
    assertThat( HandlerNames.subjectMatches( "*.created", "orders.created" ) ).isTrue();
    assertThat( HandlerNames.subjectMatches( ">", "orders_deleted" ) ).isTrue();
    assertThat( HandlerNames.subjectMatches( "orders.created", "orders.created" ) ).isTrue();
    assertThat( HandlerNames.subjectMatches( "orders.created", "orders.updated" ) ).isFalse();
    assertThat( HandlerNames.subjectMatches( "orders.>", "dlq.orders.created" ) ).isFalse();
  }
}
