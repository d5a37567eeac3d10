package io.intellixity.paging.query;

import io.intellixity.paging.exec.PagingExecutors;
import io.intellixity.paging.exec.Transacter;
import io.intellixity.paging.source.LoadParams;
import io.intellixity.paging.source.LoadResult;
import io.intellixity.paging.source.PagingConfig;
import io.intellixity.paging.source.PagingState;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class KeyedQueryPagingSourceTest {

  private static KeyedQueryPagingSource<Long, Long> source(FakeTable table) {
    return new KeyedQueryPagingSource<>(table.keyedRows(), table.boundaries(), Comparator.naturalOrder(),
        Transacter.NONE, PagingExecutors.direct());
  }

  private static LoadResult.Page<Long, Long> page(LoadResult<Long, Long> r) {
    assertInstanceOf(LoadResult.Page.class, r, () -> "expected a page but got " + r);
    return (LoadResult.Page<Long, Long>) r;
  }

  @Test
  void anchoredRefreshResolvesToThePageContainingTheAnchor() {
    FakeTable table = FakeTable.ofRange(0, 10);
    KeyedQueryPagingSource<Long, Long> src = source(table);

    LoadResult.Page<Long, Long> p = page(src.load(LoadParams.refresh(4L, 3)).join());

    assertEquals(List.of(0L, 3L, 6L, 9L), src.readyBoundariesOrNull().keys());
    assertEquals(List.of(3L, 4L, 5L), p.data());
    assertEquals(0L, p.prevKey());
    assertEquals(6L, p.nextKey());
  }

  @Test
  void appendsWalkEveryPageInOrder() {
    FakeTable table = FakeTable.ofRange(0, 10);
    KeyedQueryPagingSource<Long, Long> src = source(table);

    List<Long> seen = new ArrayList<>();
    LoadResult.Page<Long, Long> p = page(src.load(LoadParams.refresh(null, 3)).join());
    assertNull(p.prevKey());
    seen.addAll(p.data());
    while (p.nextKey() != null) {
      p = page(src.load(LoadParams.append(p.nextKey(), 3)).join());
      seen.addAll(p.data());
    }

    assertEquals(table.snapshot(), seen);
    assertEquals(List.of(9L), p.data());
    assertEquals(6L, p.prevKey());
    assertEquals(1, table.boundaryExecutions.get());
  }

  @Test
  void prependWalksBackToTheFirstPage() {
    FakeTable table = FakeTable.ofRange(0, 10);
    KeyedQueryPagingSource<Long, Long> src = source(table);

    LoadResult.Page<Long, Long> p = page(src.load(LoadParams.refresh(7L, 3)).join());
    assertEquals(List.of(6L, 7L, 8L), p.data());

    p = page(src.load(LoadParams.prepend(p.prevKey(), 3)).join());
    assertEquals(List.of(3L, 4L, 5L), p.data());
    p = page(src.load(LoadParams.prepend(p.prevKey(), 3)).join());
    assertEquals(List.of(0L, 1L, 2L), p.data());
    assertNull(p.prevKey());
    assertEquals(3L, p.nextKey());
  }

  @Test
  void boundariesAreComputedOncePerSession() {
    FakeTable table = FakeTable.ofRange(0, 10);
    KeyedQueryPagingSource<Long, Long> src = source(table);
    assertEquals(KeyedQueryPagingSource.BoundariesState.UNINITIALIZED, src.boundariesState());

    page(src.load(LoadParams.refresh(null, 3)).join());
    page(src.load(LoadParams.append(3L, 3)).join());
    page(src.load(LoadParams.prepend(0L, 3)).join());
    page(src.load(LoadParams.refresh(9L, 3)).join());

    assertEquals(1, table.boundaryExecutions.get());
    assertEquals(KeyedQueryPagingSource.BoundariesState.READY, src.boundariesState());
  }

  @Test
  void boundaryFailureFailsTheLoadThenInvalidatesTheSession() {
    FakeTable table = FakeTable.ofRange(0, 10);
    KeyedQueryPagingSource<Long, Long> src = source(table);
    QueryExecutionException boom = new QueryExecutionException("window functions unsupported");
    table.boundaryFailure = boom;

    LoadResult<Long, Long> first = src.load(LoadParams.refresh(null, 3)).join();
    LoadResult.Error<Long, Long> err = assertInstanceOf(LoadResult.Error.class, first);
    assertInstanceOf(PageBoundariesException.class, err.cause());
    assertSame(boom, err.cause().getCause());
    assertTrue(src.isInvalid());
    assertEquals(KeyedQueryPagingSource.BoundariesState.FAILED, src.boundariesState());

    table.boundaryFailure = null;
    int executions = table.executions();
    assertInstanceOf(LoadResult.Invalid.class, src.load(LoadParams.refresh(null, 3)).join());
    assertEquals(executions, table.executions());
  }

  @Test
  void unorderedBoundariesFailTheSession() {
    FakeTable table = FakeTable.ofRange(0, 10);
    PageBoundariesProvider<Long> broken = (anchor, limit) -> table.new TableQuery<>("broken", () -> List.of(6L, 3L));
    KeyedQueryPagingSource<Long, Long> src = new KeyedQueryPagingSource<>(table.keyedRows(), broken,
        Comparator.naturalOrder(), Transacter.NONE, PagingExecutors.direct());

    assertInstanceOf(LoadResult.Error.class, src.load(LoadParams.refresh(null, 3)).join());
    assertTrue(src.isInvalid());
  }

  @Test
  void loadSizeDifferentFromBoundaryPageSizeIsAnError() {
    FakeTable table = FakeTable.ofRange(0, 30);
    KeyedQueryPagingSource<Long, Long> src = source(table);
    PagingConfig nonUniform = new PagingConfig(3);

    LoadResult.Page<Long, Long> first = page(src.load(nonUniform.refresh(null)).join());
    assertEquals(9, first.data().size());

    LoadResult<Long, Long> next = src.load(nonUniform.append(first.nextKey())).join();
    LoadResult.Error<Long, Long> err = assertInstanceOf(LoadResult.Error.class, next);
    assertInstanceOf(IllegalArgumentException.class, err.cause());
    assertFalse(src.isInvalid());
  }

  @Test
  void concurrentFirstLoadsComputeBoundariesOnce() throws Exception {
    FakeTable table = FakeTable.ofRange(0, 10);
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    AtomicInteger calls = new AtomicInteger();
    PageBoundariesProvider<Long> slow = (anchor, limit) -> {
      calls.incrementAndGet();
      Query<Long> real = table.boundaries().provide(anchor, limit);
      return table.new TableQuery<>("slow boundaries", () -> {
        entered.countDown();
        try {
          assertTrue(release.await(5, TimeUnit.SECONDS));
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException(e);
        }
        return real.executeAsList();
      });
    };

    ExecutorService pool = Executors.newFixedThreadPool(4);
    try {
      KeyedQueryPagingSource<Long, Long> src = new KeyedQueryPagingSource<>(table.keyedRows(), slow,
          Comparator.naturalOrder(), Transacter.NONE, pool);

      CompletableFuture<LoadResult<Long, Long>> a = src.load(LoadParams.refresh(null, 3));
      assertTrue(entered.await(5, TimeUnit.SECONDS));
      assertEquals(KeyedQueryPagingSource.BoundariesState.COMPUTING, src.boundariesState());
      CompletableFuture<LoadResult<Long, Long>> b = src.load(LoadParams.refresh(4L, 3));
      CompletableFuture<LoadResult<Long, Long>> c = src.load(LoadParams.refresh(8L, 3));
      release.countDown();

      assertEquals(List.of(0L, 1L, 2L), page(a.get(5, TimeUnit.SECONDS)).data());
      assertEquals(List.of(3L, 4L, 5L), page(b.get(5, TimeUnit.SECONDS)).data());
      assertEquals(List.of(6L, 7L, 8L), page(c.get(5, TimeUnit.SECONDS)).data());
      assertEquals(1, calls.get());
      assertEquals(1, table.boundaryExecutions.get());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void descendingKeyOrder() {
    FakeTable table = FakeTable.ofRange(0, 10);
    PageBoundariesProvider<Long> boundaries = (anchor, limit) -> table.new TableQuery<>("desc boundaries", () -> List.of(9L, 6L, 3L, 0L));
    KeyedQueryProvider<Long, Long> rows = (begin, end) -> table.new TableQuery<>("desc rows", () -> {
      List<Long> out = new ArrayList<>();
      for (long v = 9; v >= 0; v--) {
        if (v <= begin && (end == null || v > end)) out.add(v);
      }
      return out;
    });
    KeyedQueryPagingSource<Long, Long> src = new KeyedQueryPagingSource<>(rows, boundaries,
        Comparator.<Long>naturalOrder().reversed(), Transacter.NONE, PagingExecutors.direct());

    LoadResult.Page<Long, Long> p = page(src.load(LoadParams.refresh(5L, 3)).join());

    assertEquals(List.of(6L, 5L, 4L), p.data());
    assertEquals(9L, p.prevKey());
    assertEquals(3L, p.nextKey());
  }

  @Test
  void emptyDatasetReturnsEmptyPageAndObservesInserts() {
    FakeTable table = FakeTable.ofRange(0, 0);
    KeyedQueryPagingSource<Long, Long> src = source(table);

    LoadResult.Page<Long, Long> p = page(src.load(LoadParams.refresh(null, 3)).join());
    assertTrue(p.data().isEmpty());
    assertNull(p.prevKey());
    assertNull(p.nextKey());
    assertEquals(0, table.rowExecutions.get());

    table.insert(5);
    assertTrue(src.isInvalid());
  }

  @Test
  void changeDuringBoundaryComputationYieldsInvalid() {
    FakeTable table = FakeTable.ofRange(0, 10);
    PageBoundariesProvider<Long> racing = (anchor, limit) -> table.new TableQuery<>("racing boundaries", () -> {
      table.insert(-5);
      return List.of(0L, 3L, 6L, 9L);
    });
    KeyedQueryPagingSource<Long, Long> src = new KeyedQueryPagingSource<>(table.keyedRows(), racing,
        Comparator.naturalOrder(), Transacter.NONE, PagingExecutors.direct());

    assertInstanceOf(LoadResult.Invalid.class, src.load(LoadParams.refresh(null, 3)).join());
    assertTrue(src.isInvalid());
    assertEquals(0, table.rowExecutions.get());
    assertEquals(0, table.listenerCount());
  }

  @Test
  void changeDuringPageReadYieldsInvalid() {
    FakeTable table = FakeTable.ofRange(0, 10);
    KeyedQueryProvider<Long, Long> racing = (begin, end) -> table.new TableQuery<>("racing rows", () -> {
      table.insert(99);
      return List.of(0L, 1L, 2L);
    });
    KeyedQueryPagingSource<Long, Long> src = new KeyedQueryPagingSource<>(racing, table.boundaries(),
        Comparator.naturalOrder(), Transacter.NONE, PagingExecutors.direct());

    assertInstanceOf(LoadResult.Invalid.class, src.load(LoadParams.refresh(null, 3)).join());
    assertTrue(src.isInvalid());
  }

  @Test
  void boundariesQueryIsObservedWhileItRuns() {
    FakeTable table = FakeTable.ofRange(0, 10);
    AtomicInteger observers = new AtomicInteger(-1);
    PageBoundariesProvider<Long> watching = (anchor, limit) -> table.new TableQuery<>("watched boundaries", () -> {
      observers.set(table.listenerCount());
      return List.of(0L, 3L, 6L, 9L);
    });
    KeyedQueryPagingSource<Long, Long> src = new KeyedQueryPagingSource<>(table.keyedRows(), watching,
        Comparator.naturalOrder(), Transacter.NONE, PagingExecutors.direct());

    page(src.load(LoadParams.refresh(null, 3)).join());

    assertEquals(1, observers.get());
    assertEquals("rows [0, 3)", String.valueOf(src.currentQuery()));
  }

  @Test
  void dataChangeInvalidatesWithoutFurtherQueries() {
    FakeTable table = FakeTable.ofRange(0, 10);
    KeyedQueryPagingSource<Long, Long> src = source(table);
    page(src.load(LoadParams.refresh(null, 3)).join());

    table.insert(10);
    int executions = table.executions();

    assertInstanceOf(LoadResult.Invalid.class, src.load(LoadParams.append(3L, 3)).join());
    assertEquals(executions, table.executions());
    assertEquals(0, table.listenerCount());
  }

  @Test
  void refreshKeyIsTheStartOfTheLastLoadedPage() {
    FakeTable table = FakeTable.ofRange(0, 10);
    KeyedQueryPagingSource<Long, Long> src = source(table);
    PagingConfig config = PagingConfig.uniform(3);

    LoadResult.Page<Long, Long> p = page(src.load(LoadParams.refresh(4L, 3)).join());
    assertEquals(3L, src.getRefreshKey(new PagingState<>(List.of(p), null, config)));

    LoadResult.Page<Long, Long> last = page(src.load(LoadParams.append(9L, 3)).join());
    assertEquals(9L, src.getRefreshKey(new PagingState<>(List.of(p, last), null, config)));

    assertNull(src.getRefreshKey(new PagingState<>(List.of(), 4, config)));
    assertFalse(src.jumpingSupported());
  }

  @Test
  void refreshKeyIsNullBeforeBoundariesExist() {
    KeyedQueryPagingSource<Long, Long> src = source(FakeTable.ofRange(0, 10));
    LoadResult.Page<Long, Long> p = new LoadResult.Page<>(List.of(3L), 0L, 6L);

    assertNull(src.getRefreshKey(new PagingState<>(List.of(p), null, PagingConfig.uniform(3))));
  }
}
