package com.bell.api.controller;

import com.bell.api.model.DatapointsResponse;
import com.bell.api.model.NamesResponse;
import com.bell.api.service.DatapointQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class DatapointsController {

  private static final Logger log = LoggerFactory.getLogger(DatapointsController.class);

  private final DatapointQueryService query;

  public DatapointsController(DatapointQueryService query) {
    this.query = query;
  }

  @GetMapping("/api/datapoints/{name}/{start}/{stop}")
  public ResponseEntity<DatapointsResponse> getDatapoints(@PathVariable("name") String name,
                                                          @PathVariable("start") long start,
                                                          @PathVariable("stop") long stop) {
    if (start > stop) {
      return ResponseEntity.badRequest().build();
    }
    return ResponseEntity.ok(query.datapoints(name, start, stop));
  }

  @GetMapping("/api/names")
  public NamesResponse getNames(
      @RequestParam(name = "pattern", defaultValue = "*") String pattern,
      @RequestParam(name = "limit", defaultValue = "50") int limit
  ) {
    int n = Math.max(1, Math.min(limit, 1000));
    return query.names(pattern, n);
  }

  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<Map<String, String>> storeUnavailable(DataAccessException e) {
    log.warn("metric store unavailable: {}", e.getMessage());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", "metric store unavailable"));
  }
}
