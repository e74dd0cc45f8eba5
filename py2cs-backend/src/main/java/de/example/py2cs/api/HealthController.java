package de.example.py2cs.api;

import java.time.Instant;
import java.util.Map;

import de.example.py2cs.TranslatorProperties;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping({"/api", ""})
public class HealthController {

  private final TranslatorProperties props;

  public HealthController(TranslatorProperties props) {
    this.props = props;
  }

  @GetMapping(value = {"/health", "/health/"}, produces = MediaType.APPLICATION_JSON_VALUE)
  public Map<String, Object> health() {
    return Map.of(
        "status", "ok",
        "service", "py2cs-backend",
        "target", "C#",
        "namespace", props.getNamespace(),
        "maxInputChars", props.getMaxInputChars(),
        "time", Instant.now().toString()
    );
  }
}
