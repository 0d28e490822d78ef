package com.courtbot.sms.app.api;

import com.courtbot.sms.app.model.CaseSearchResult;
import com.courtbot.sms.app.service.CaseSearchService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@Log4j2
@RestController
@RequiredArgsConstructor
public class CaseSearchController {

  private final CaseSearchService caseSearchService;

  @GetMapping(value = "/", produces = MediaType.TEXT_PLAIN_VALUE)
  @ResponseStatus(HttpStatus.OK)
  public String hello() {
    return "Hello, I am Courtbot. I have a heart of justice and a knowledge of court cases.";
  }

  /** Partial-name or exact-citation search; dates come back pre-rendered. */
  @GetMapping(path = "/cases", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<List<CaseSearchResult>> search(
      @RequestParam(name = "q", required = false) String q) {
    if (q == null || q.isBlank()) {
      return ResponseEntity.badRequest().build();
    }
    List<CaseSearchResult> hits = caseSearchService.search(q);
    log.info("cases.search chars={} hits={}", q.length(), hits.size());
    return ResponseEntity.ok(hits);
  }
}
