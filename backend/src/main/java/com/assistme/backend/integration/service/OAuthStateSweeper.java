package com.assistme.backend.integration.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Removes authorization states past their expiry. */
@Component
public class OAuthStateSweeper {

  private static final Logger log = LoggerFactory.getLogger(OAuthStateSweeper.class);

  private final OAuthStateStore stateStore;

  public OAuthStateSweeper(OAuthStateStore stateStore) {
    this.stateStore = stateStore;
  }

  @Scheduled(fixedDelayString = "${app.integrations.state-sweep-delay:PT5M}")
  public void purgeExpiredStates() {
    int removed = stateStore.purgeExpired();
    if (removed > 0) {
      log.info("Removed {} expired authorization states", removed);
    }
  }
}
