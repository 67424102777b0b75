package io.upreview.backend.multitenancy;

import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Binds the acting user to the current database transaction so row-level security policies can
 * read it via {@code current_setting('app.user_id', true)}.
 */
@Component
public class TenantSessionContext {

  private final JdbcClient jdbc;

  public TenantSessionContext(JdbcClient jdbc) {
    this.jdbc = jdbc;
  }

  /** Transaction-local: the setting is cleared when the surrounding transaction ends. */
  @Transactional(propagation = Propagation.MANDATORY)
  public void bindActor(String actorId) {
    jdbc.sql("SELECT set_config('app.user_id', ?, true)")
        .param(actorId)
        .query(String.class)
        .single();
  }
}
