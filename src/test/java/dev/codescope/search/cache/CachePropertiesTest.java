package dev.codescope.search.cache;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class CachePropertiesTest {

  @Test
  void defaultsAreValid() {
    assertThatCode(() -> new CacheProperties().validate()).doesNotThrowAnyException();
  }

  @Test
  void zeroTtlFailsStartup() {
    CacheProperties properties = new CacheProperties();
    properties.setTtl(Duration.ZERO);

    assertThatThrownBy(properties::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("codescope.cache.ttl");
  }

  @Test
  void capacityMustBePositive() {
    CacheProperties properties = new CacheProperties();
    properties.setMaxEntries(0);

    assertThatThrownBy(properties::validate).isInstanceOf(IllegalStateException.class);
  }
}
