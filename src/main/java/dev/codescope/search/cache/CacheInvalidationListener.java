package dev.codescope.search.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Drops cached results that a file change may have made stale.
 *
 * <p>Entries mentioning the file are always removed. A newly added file can match queries whose
 * cached results never mentioned it, so additions also drop the entries of the file's language.
 */
@Component
public class CacheInvalidationListener {

  private static final Logger log = LoggerFactory.getLogger(CacheInvalidationListener.class);

  private final QueryCache queryCache;

  public CacheInvalidationListener(QueryCache queryCache) {
    this.queryCache = queryCache;
  }

  @EventListener
  public void onSourceFileChanged(SourceFileChangedEvent event) {
    log.debug("File {} {}", event.filePath(), event.change());
    queryCache.invalidateByFile(event.filePath());
    if (event.change() == SourceFileChangedEvent.ChangeType.ADDED && event.language() != null) {
      queryCache.invalidateByLanguage(event.language());
    }
  }
}
