package com.system.packsolver.api;

import com.system.packsolver.schemas.algorithm.Input.InvalidPackingConfigurationException;
import com.system.packsolver.schemas.algorithm.Input.PackingInputException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class PackingExceptionHandler {

  @ExceptionHandler(PackingInputException.class)
  public ResponseEntity<Map<String, Object>> handlePackingInput(PackingInputException ex) {
    log.warn("Rejected packing request: {}", ex.getMessage());

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("success", false);
    body.put("error", ex instanceof InvalidPackingConfigurationException ?
        "invalid_configuration" : "invalid_input");
    body.put("message", ex.getMessage());
    return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
  }
}
