package io.intellixity.paging.examples.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.intellixity.paging.examples.session.PagingSession;

import java.util.Locale;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionResponse(String id, String mode, int pageSize, int initialLoadSize, Long startKey) {
  static SessionResponse of(PagingSession s) {
    return new SessionResponse(s.id(), s.mode().name().toLowerCase(Locale.ROOT),
        s.config().pageSize(), s.config().initialLoadSize(), s.startKey());
  }
}
