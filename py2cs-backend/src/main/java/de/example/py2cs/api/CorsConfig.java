package de.example.py2cs.api;

import de.example.py2cs.TranslatorProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class CorsConfig implements WebMvcConfigurer {

  private final TranslatorProperties props;

  public CorsConfig(TranslatorProperties props) {
    this.props = props;
  }

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    registry.addMapping("/api/**")
      .allowedOriginPatterns(props.getCorsOrigins().toArray(String[]::new))
      .allowedMethods("GET", "POST", "OPTIONS")
      .allowedHeaders("*")
      // front ends show the marker count
      .exposedHeaders(TranslateController.UNSUPPORTED_HEADER)
      .maxAge(3600);
  }
}
