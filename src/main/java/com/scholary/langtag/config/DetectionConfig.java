package com.scholary.langtag.config;

import com.github.pemistahl.lingua.api.LanguageDetector;
import com.github.pemistahl.lingua.api.LanguageDetectorBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the classification engine.
 *
 * <p>Binds the detection, subtitle and tracking properties and provides the text language
 * detector. Lingua loads each language model lazily on first use.
 */
@Configuration
@EnableConfigurationProperties({
  DetectionProperties.class,
  SubtitleProperties.class,
  TrackingProperties.class
})
public class DetectionConfig {

  @Bean
  public LanguageDetector linguaLanguageDetector() {
    return LanguageDetectorBuilder.fromAllLanguages().build();
  }
}
