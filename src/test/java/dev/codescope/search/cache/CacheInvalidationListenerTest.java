package dev.codescope.search.cache;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import dev.codescope.search.cache.SourceFileChangedEvent.ChangeType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CacheInvalidationListenerTest {

  @Mock QueryCache queryCache;

  @InjectMocks CacheInvalidationListener listener;

  @Test
  void modifiedFileInvalidatesByFileOnly() {
    listener.onSourceFileChanged(
        new SourceFileChangedEvent("src/auth.ts", "typescript", ChangeType.MODIFIED));

    verify(queryCache).invalidateByFile("src/auth.ts");
    verify(queryCache, never()).invalidateByLanguage(anyString());
  }

  @Test
  void addedFileAlsoInvalidatesItsLanguage() {
    listener.onSourceFileChanged(
        new SourceFileChangedEvent("src/new.py", "python", ChangeType.ADDED));

    verify(queryCache).invalidateByFile("src/new.py");
    verify(queryCache).invalidateByLanguage("python");
  }

  @Test
  void addedFileWithoutLanguageInvalidatesByFileOnly() {
    listener.onSourceFileChanged(new SourceFileChangedEvent("notes", null, ChangeType.ADDED));

    verify(queryCache).invalidateByFile("notes");
    verify(queryCache, never()).invalidateByLanguage(anyString());
  }
}
