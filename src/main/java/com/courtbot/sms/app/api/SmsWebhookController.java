package com.courtbot.sms.app.api;

import com.courtbot.sms.app.model.DialogueReply;
import com.courtbot.sms.app.service.DialogueService;
import com.courtbot.sms.app.util.PhoneMasker;
import com.courtbot.sms.app.util.TwimlRenderer;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@Log4j2
@Validated
@RestController
@RequiredArgsConstructor
public class SmsWebhookController {

  private final DialogueService dialogueService;

  // ------------------------------------------------------------
  // /sms  (SMS provider webhook, form-encoded)
  // ------------------------------------------------------------
  @PostMapping(
      path = "/sms",
      consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE,
      produces = MediaType.APPLICATION_XML_VALUE)
  public ResponseEntity<String> inbound(
      @RequestParam("From") @NotBlank String from,
      @RequestParam(name = "Body", required = false, defaultValue = "") String body) {
    log.info("sms.inbound phone={} chars={}", PhoneMasker.mask(from), body.length());
    DialogueReply reply = dialogueService.handle(from, body);
    return ResponseEntity.ok()
        .contentType(MediaType.APPLICATION_XML)
        .body(TwimlRenderer.render(reply.getMessages()));
  }
}
