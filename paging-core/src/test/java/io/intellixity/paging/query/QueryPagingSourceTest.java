package io.intellixity.paging.query;

import io.intellixity.paging.exec.PagingExecutors;
import io.intellixity.paging.exec.Transacter;
import io.intellixity.paging.source.LoadParams;
import io.intellixity.paging.source.LoadResult;
import io.intellixity.paging.source.PagingState;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class QueryPagingSourceTest {

  private static final class BareSource extends QueryPagingSource<Long, Long> {
    BareSource() {
      super(Transacter.NONE, PagingExecutors.direct());
    }

    @Override protected LoadResult<Long, Long> loadInTransaction(LoadParams<Long> params) { throw new UnsupportedOperationException(); }
    @Override public boolean jumpingSupported() { return false; }
    @Override public Long getRefreshKey(PagingState<Long, Long> state) { return null; }

    boolean swap(Query<?> q) { return setCurrentQuery(q); }
  }

  @Test
  void setCurrentQueryReplacesTheObservedQuery() {
    FakeTable table = FakeTable.ofRange(0, 3);
    BareSource src = new BareSource();
    Query<Long> first = table.countQuery();
    Query<Long> second = table.countQuery();

    assertTrue(src.swap(first));
    assertTrue(src.swap(second));

    assertSame(second, src.currentQuery());
    assertEquals(1, table.listenerCount());
    assertEquals(1, table.maxListeners.get());
  }

  @Test
  void invalidateDetachesAndRefusesNewQueries() {
    FakeTable table = FakeTable.ofRange(0, 3);
    BareSource src = new BareSource();
    src.swap(table.countQuery());

    src.invalidate();

    assertNull(src.currentQuery());
    assertEquals(0, table.listenerCount());
    assertFalse(src.swap(table.countQuery()));
    assertEquals(0, table.listenerCount());
  }

  @Test
  void changeNotificationInvalidatesTheSource() {
    FakeTable table = FakeTable.ofRange(0, 3);
    BareSource src = new BareSource();
    src.swap(table.countQuery());

    table.touch();

    assertTrue(src.isInvalid());
    assertNull(src.currentQuery());
    assertEquals(0, table.listenerCount());
  }

  @Test
  void loadFailureBecomesAnErrorResult() {
    LoadResult<Long, Long> r = new BareSource().load(LoadParams.refresh(null, 3)).join();
    LoadResult.Error<Long, Long> err = assertInstanceOf(LoadResult.Error.class, r);
    assertInstanceOf(UnsupportedOperationException.class, err.cause());
  }
}
