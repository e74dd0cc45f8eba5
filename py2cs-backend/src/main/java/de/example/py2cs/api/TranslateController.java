package de.example.py2cs.api;

import de.example.py2cs.PythonToCSharpTranslator;
import de.example.py2cs.Translation;
import de.example.py2cs.TranslatorProperties;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api")
public class TranslateController {

  static final String UNSUPPORTED_HEADER = "X-Py2cs-Unsupported";

  private final PythonToCSharpTranslator translator;
  private final int maxInputChars;

  public TranslateController(PythonToCSharpTranslator translator, TranslatorProperties props) {
    this.translator = translator;
    this.maxInputChars = props.getMaxInputChars();
  }

  @PostMapping(value = {"/translate", "/translate/"}, consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.TEXT_PLAIN_VALUE)
  public ResponseEntity<String> translate(@RequestBody(required = false) String tree) {
    if (tree == null || tree.isBlank()) return ResponseEntity.ok("");
    if (tree.length() > maxInputChars) return ResponseEntity.badRequest().body("Input too large.");

    Translation t = translator.translateSource(tree);
    return ResponseEntity.ok()
        .header(UNSUPPORTED_HEADER, String.valueOf(t.unsupported().size()))
        .body(t.code());
  }
}
