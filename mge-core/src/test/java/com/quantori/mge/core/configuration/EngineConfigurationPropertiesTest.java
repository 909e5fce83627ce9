package com.quantori.mge.core.configuration;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class EngineConfigurationPropertiesTest {

  @ParameterizedTest
  @CsvSource({
      "10, 40",
      "60, 40",
      "61, 25",
      "100, 25",
      "101, 22",
      "151, 20",
      "5000, 20"
  })
  void testDefaultThresholds(int atomCount, int expected) {
    assertThat(EngineConfigurationProperties.defaults().maxRingSizeFor(atomCount))
        .isEqualTo(expected);
  }

  @Test
  void testThresholdNeverExceedsMaxRingSize() {
    EngineConfigurationProperties properties = EngineConfigurationProperties.builder()
        .maxRingSize(8)
        .ringSizeThresholds(List.of(new RingSizeThreshold(20, 12), new RingSizeThreshold(50, 6)))
        .build();

    assertThat(properties.maxRingSizeFor(10)).isEqualTo(8);
    assertThat(properties.maxRingSizeFor(30)).isEqualTo(8);
    assertThat(properties.maxRingSizeFor(60)).isEqualTo(6);
  }

  @Test
  void testDefaults() {
    EngineConfigurationProperties properties = EngineConfigurationProperties.defaults();

    assertThat(properties.isStrictValence()).isFalse();
    assertThat(properties.getDfsAtomLimit()).isEqualTo(60);
    assertThat(properties.getDefaultMaxSearchSteps()).isEqualTo(1_000_000);
  }
}
