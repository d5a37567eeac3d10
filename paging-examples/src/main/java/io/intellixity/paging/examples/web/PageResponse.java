package io.intellixity.paging.examples.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.intellixity.paging.source.LoadResult;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PageResponse(String sessionId,
                           List<Long> data,
                           Long prevKey,
                           Long nextKey,
                           Integer itemsBefore,
                           Integer itemsAfter) {

  static PageResponse of(String sessionId, LoadResult.Page<Long, Long> page) {
    return new PageResponse(sessionId, page.data(), page.prevKey(), page.nextKey(),
        count(page.itemsBefore()), count(page.itemsAfter()));
  }

  private static Integer count(int n) {
    return (n == LoadResult.COUNT_UNDEFINED) ? null : n;
  }
}
