package de.example.py2cs.api;

import de.example.py2cs.InvalidTreeException;
import de.example.py2cs.SourceSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.*;

@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(SourceSyntaxException.class)
  public ResponseEntity<String> handleSyntax(SourceSyntaxException e) {
    log.warn("Rejected tree document: {}", e.getMessage());
    String where = e.getLine() > 0 ? " (line " + e.getLine() + ", column " + e.getColumn() + ")" : "";
    return ResponseEntity.badRequest()
        .contentType(MediaType.TEXT_PLAIN)
        .body("Parse error" + where + ". Expected the JSON dump of a Python ast.Module.\n\n" + e.getMessage());
  }

  @ExceptionHandler(InvalidTreeException.class)
  public ResponseEntity<String> handleInvalidTree(InvalidTreeException e) {
    log.warn("Invalid tree: {}", e.getMessage());
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .contentType(MediaType.TEXT_PLAIN)
        .body("Invalid tree.\n\n" + e.getMessage());
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<String> handleUnreadable(HttpMessageNotReadableException e) {
    log.warn("Unreadable request body: {}", e.getMessage());
    return ResponseEntity.badRequest()
        .contentType(MediaType.TEXT_PLAIN)
        .body("Request body could not be read.");
  }
}
