package com.courtbot.sms.app.service;

import com.courtbot.sms.app.config.CourtbotProperties;
import com.courtbot.sms.app.exception.SenderBusyException;
import com.courtbot.sms.app.exception.StoreUnavailableException;
import com.courtbot.sms.app.model.CaseRecord;
import com.courtbot.sms.app.model.ConversationState;
import com.courtbot.sms.app.model.DialogueReply;
import com.courtbot.sms.app.model.MatchResult;
import com.courtbot.sms.app.model.PendingQuestion;
import com.courtbot.sms.app.model.QueueStatus;
import com.courtbot.sms.app.model.QueuedLookup;
import com.courtbot.sms.app.model.ReminderSubscription;
import com.courtbot.sms.app.repository.ConversationStateRepository;
import com.courtbot.sms.app.repository.SubscriptionStore;
import com.courtbot.sms.app.util.PhoneMasker;
import com.courtbot.sms.app.util.SenderLockRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import java.util.Set;
import lombok.extern.log4j.Log4j2;

/**
 * Dialogue controller: decides, per inbound text, which pending question is being answered, what
 * to reply and which subscription to persist.
 *
 * <ol>
 *   <li>Idle: look the text up. Unique case -> offer a reminder. Plausible citation -> offer to
 *       keep checking. Anything else -> format message.
 *   <li>Awaiting reminder answer: YES stores a reminder from the snapshot, NO opts out, anything
 *       else gets no reply and keeps the question open.
 *   <li>Awaiting queue answer: YES activates the queued lookup, NO declines it, anything else gets
 *       no reply.
 * </ol>
 *
 * <p>A question rebuilt from an open queue row after the stored state was lost only captures YES
 * or NO; any other text withdraws it and is looked up as usual. A reminder offer whose court date
 * has passed is closed instead of asked.
 *
 * <p>Load, decide and persist run inside one per-sender lock. Side effects are written before the
 * next state, so a failed write leaves the sender at the same question and the next message retries
 * it. Store failures become an apology; they never escape {@link #handle}.
 */
@Log4j2
public class DialogueService {

  private static final Set<String> AFFIRMATIVE_WORDS = Set.of("YES", "Y", "YEA", "YUP");
  private static final Set<String> NEGATIVE_WORDS = Set.of("NO", "N");

  enum Answer {
    AFFIRMATIVE,
    NEGATIVE,
    UNRECOGNIZED;

    static Answer parse(String normalized) {
      if (AFFIRMATIVE_WORDS.contains(normalized)) return AFFIRMATIVE;
      if (NEGATIVE_WORDS.contains(normalized)) return NEGATIVE;
      return UNRECOGNIZED;
    }
  }

  private final CitationMatcher matcher;
  private final ConversationStateRepository states;
  private final SubscriptionStore subscriptions;
  private final SenderLockRegistry locks;
  private final ReplyTemplates templates;
  private final Clock clock;
  private final Duration queueTtl;

  public DialogueService(
      CitationMatcher matcher,
      ConversationStateRepository states,
      SubscriptionStore subscriptions,
      SenderLockRegistry locks,
      ReplyTemplates templates,
      CourtbotProperties props,
      Clock clock) {
    this.matcher = matcher;
    this.states = states;
    this.subscriptions = subscriptions;
    this.locks = locks;
    this.templates = templates;
    this.clock = clock;
    this.queueTtl = Duration.ofDays(props.getQueueTtlDays());
  }

  /** Handles one inbound message and returns the reply segments (possibly none). */
  public DialogueReply handle(String phone, String body) {
    String text = CitationMatcher.normalize(body);
    try {
      DialogueReply reply = locks.withLock(phone, () -> handleLocked(phone, text));
      log.info(
          "dialogue.reply phone={} segments={}", PhoneMasker.mask(phone), reply.getMessages().size());
      return reply;
    } catch (StoreUnavailableException | SenderBusyException ex) {
      log.error(
          "dialogue.error phone={} type={} msg={}",
          PhoneMasker.mask(phone),
          ex.getClass().getSimpleName(),
          ex.getMessage(),
          ex);
      return DialogueReply.of(templates.apology());
    }
  }

  /** Current state for a sender as the next message would see it. */
  public ConversationState currentState(String phone) {
    return resolveState(phone);
  }

  // ------------------------------------------------------------
  // State machine
  // ------------------------------------------------------------

  private DialogueReply handleLocked(String phone, String text) {
    Answer answer = Answer.parse(text);
    Optional<ConversationState> stored = states.find(phone);
    if (stored.isPresent() && !stored.get().isIdle()) {
      return dispatch(stored.get(), answer, text);
    }

    ConversationState base = stored.orElseGet(() -> ConversationState.idle(phone));
    Optional<QueuedLookup> open = subscriptions.findQueuedLookupBySender(phone);
    if (open.isEmpty()) {
      return onIdle(base, answer, text);
    }
    QueuedLookup row = open.get();
    if (isLapsed(row)) {
      subscriptions.resolveQueuedLookup(
          row.getId(), QueueStatus.REMINDER_OFFERED, QueueStatus.EXPIRED);
      log.info("dialogue.offerLapsed phone={} queueId={}", PhoneMasker.mask(phone), row.getId());
      return onIdle(base, answer, text);
    }

    ConversationState resumed = resume(base, row);
    if (answer == Answer.UNRECOGNIZED) {
      // A question rebuilt from a queue row only captures YES or NO; other text is a new lookup.
      withdrawOffer(resumed, row);
      return onIdle(base, answer, text);
    }
    return dispatch(resumed, answer, text);
  }

  private DialogueReply dispatch(ConversationState state, Answer answer, String text) {
    switch (state.getPendingQuestion()) {
      case AWAITING_REMINDER_CONFIRM:
        return onReminderAnswer(state, answer);
      case AWAITING_QUEUE_CONFIRM:
        return onQueueAnswer(state, answer, text);
      default:
        return onIdle(state, answer, text);
    }
  }

  private DialogueReply onIdle(ConversationState state, Answer answer, String text) {
    if (answer != Answer.UNRECOGNIZED) {
      // A YES/NO with nothing pending answers a question that is no longer open.
      log.debug("dialogue.staleConfirmation phone={}", PhoneMasker.mask(state.getPhone()));
      return DialogueReply.none();
    }

    MatchResult result = matcher.match(text);
    switch (result.getOutcome()) {
      case UNIQUE:
        {
          CaseRecord snapshot = result.getMatch().snapshot();
          states.save(
              state.toIdle().toBuilder()
                  .pendingQuestion(PendingQuestion.AWAITING_REMINDER_CONFIRM)
                  .matchedCase(snapshot)
                  .build());
          return DialogueReply.of(templates.caseFound(snapshot));
        }
      case PLAUSIBLE_UNFOUND:
        {
          QueuedLookup offer =
              subscriptions.createQueuedLookup(
                  QueuedLookup.builder()
                      .citationText(result.getQueryText())
                      .phone(state.getPhone())
                      .status(QueueStatus.OFFERED)
                      .build());
          try {
            states.save(
                state.toIdle().toBuilder()
                    .pendingQuestion(PendingQuestion.AWAITING_QUEUE_CONFIRM)
                    .pendingCitationText(result.getQueryText())
                    .queuedLookupId(offer.getId())
                    .build());
          } catch (StoreUnavailableException ex) {
            discardOffer(offer, ex);
            throw ex;
          }
          return DialogueReply.of(templates.caseNotFound());
        }
      default:
        states.save(state.toIdle());
        return DialogueReply.of(templates.malformedCitation());
    }
  }

  private DialogueReply onReminderAnswer(ConversationState state, Answer answer) {
    switch (answer) {
      case AFFIRMATIVE:
        {
          CaseRecord snapshot = state.getMatchedCase();
          subscriptions.createReminder(
              ReminderSubscription.builder()
                  .caseId(snapshot.getId())
                  .phone(state.getPhone())
                  .originalCase(snapshot)
                  .build());
          closeQueueRow(state, QueueStatus.REMINDER_OFFERED, QueueStatus.FOUND);
          states.save(state.toIdle());
          return DialogueReply.of(templates.reminderConfirmed());
        }
      case NEGATIVE:
        closeQueueRow(state, QueueStatus.REMINDER_OFFERED, QueueStatus.FOUND);
        states.save(state.toIdle());
        return DialogueReply.of(templates.optedOut());
      default:
        log.debug("dialogue.unrecognized phone={} pending=reminder", mask(state));
        return DialogueReply.none();
    }
  }

  private DialogueReply onQueueAnswer(ConversationState state, Answer answer, String text) {
    switch (answer) {
      case AFFIRMATIVE:
        {
          Instant now = clock.instant();
          Instant expiresAt = now.plus(queueTtl);
          if (state.getQueuedLookupId() == null) {
            subscriptions.createQueuedLookup(
                QueuedLookup.builder()
                    .citationText(state.getPendingCitationText())
                    .phone(state.getPhone())
                    .status(QueueStatus.ACTIVE)
                    .createdAt(now)
                    .expiresAt(expiresAt)
                    .build());
          } else if (!subscriptions.activateQueuedLookup(
              state.getQueuedLookupId(), now, expiresAt)) {
            // Accepted on an earlier attempt whose state write failed.
            log.info("dialogue.queueAlreadyActive queueId={}", state.getQueuedLookupId());
          }
          states.save(state.toIdle());
          return DialogueReply.of(templates.queueConfirmed());
        }
      case NEGATIVE:
        closeQueueRow(state, QueueStatus.OFFERED, QueueStatus.DECLINED);
        states.save(state.toIdle());
        return DialogueReply.of(templates.optedOut());
      default:
        log.debug("dialogue.unrecognized phone={} pending=queue text={}", mask(state), text);
        return DialogueReply.none();
    }
  }

  // ------------------------------------------------------------
  // Helpers
  // ------------------------------------------------------------

  /**
   * Stored state if it carries a question; otherwise an open question reconstructed from the
   * subscription store (a keep-checking offer, or a reminder offer sent by the sweep); otherwise
   * idle.
   */
  private ConversationState resolveState(String phone) {
    Optional<ConversationState> stored = states.find(phone);
    if (stored.isPresent() && !stored.get().isIdle()) {
      return stored.get();
    }
    ConversationState base = stored.orElseGet(() -> ConversationState.idle(phone));
    return subscriptions
        .findQueuedLookupBySender(phone)
        .filter(row -> !isLapsed(row))
        .map(row -> resume(base, row))
        .orElse(base);
  }

  private ConversationState resume(ConversationState base, QueuedLookup row) {
    log.info(
        "dialogue.resume phone={} queueId={} status={}",
        PhoneMasker.mask(base.getPhone()),
        row.getId(),
        row.getStatus());
    if (row.getStatus() == QueueStatus.REMINDER_OFFERED && row.getMatchedCase() != null) {
      return base.toBuilder()
          .pendingQuestion(PendingQuestion.AWAITING_REMINDER_CONFIRM)
          .matchedCase(row.getMatchedCase())
          .queuedLookupId(row.getId())
          .build();
    }
    return base.toBuilder()
        .pendingQuestion(PendingQuestion.AWAITING_QUEUE_CONFIRM)
        .pendingCitationText(row.getCitationText())
        .queuedLookupId(row.getId())
        .build();
  }

  /** A reminder offer for a case whose court date has already passed. */
  private boolean isLapsed(QueuedLookup row) {
    if (row.getStatus() != QueueStatus.REMINDER_OFFERED || row.getMatchedCase() == null) {
      return false;
    }
    LocalDate courtDate = row.getMatchedCase().getDate();
    return courtDate != null && courtDate.isBefore(LocalDate.now(clock));
  }

  private void withdrawOffer(ConversationState resumed, QueuedLookup row) {
    QueueStatus outcome =
        row.getStatus() == QueueStatus.REMINDER_OFFERED ? QueueStatus.FOUND : QueueStatus.DECLINED;
    subscriptions.resolveQueuedLookup(row.getId(), row.getStatus(), outcome);
    log.info(
        "dialogue.offerWithdrawn phone={} queueId={} status={}",
        mask(resumed),
        row.getId(),
        row.getStatus());
  }

  private void discardOffer(QueuedLookup offer, StoreUnavailableException cause) {
    try {
      subscriptions.resolveQueuedLookup(offer.getId(), QueueStatus.OFFERED, QueueStatus.DECLINED);
    } catch (StoreUnavailableException ex) {
      cause.addSuppressed(ex);
      log.warn("dialogue.offerOrphaned queueId={} msg={}", offer.getId(), ex.getMessage());
    }
  }

  private void closeQueueRow(ConversationState state, QueueStatus expected, QueueStatus outcome) {
    if (state.getQueuedLookupId() == null) return;
    subscriptions.resolveQueuedLookup(state.getQueuedLookupId(), expected, outcome);
  }

  private static String mask(ConversationState state) {
    return PhoneMasker.mask(state.getPhone());
  }
}
