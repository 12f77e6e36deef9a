/*
 * どこで: トリガー API
 * 何を: プラットフォームのトリガーごとに POST を受け、通知オーケストレータへ渡す
 * なぜ: CRUD 層は別プロセスで動き、自身の書き込み後にここを呼ぶため
 */
package com.example.pipeline.api;

import com.example.pipeline.api.request.EventCancelledRequest;
import com.example.pipeline.api.request.ModerationRequest;
import com.example.pipeline.api.request.NewCommentRequest;
import com.example.pipeline.api.request.NewFavoriteRequest;
import com.example.pipeline.api.request.ParticipationDecisionRequest;
import com.example.pipeline.api.request.ProgrammeChangedRequest;
import com.example.pipeline.orchestrator.ModerationAction;
import com.example.pipeline.orchestrator.NotificationOrchestrator;
import com.example.pipeline.orchestrator.NotificationResult;
import com.example.pipeline.orchestrator.ParticipationDecision;
import com.example.pipeline.orchestrator.ProgrammeChangeType;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/triggers")
@RequiredArgsConstructor
public class TriggerController {

  private final NotificationOrchestrator orchestrator;

  @PostMapping("/events/{eventId}/participants/{userId}/decision")
  public NotificationResult participationDecision(
      @PathVariable("eventId") long eventId,
      @PathVariable("userId") long userId,
      @Valid @RequestBody ParticipationDecisionRequest request) {
    return orchestrator.notifyParticipationDecision(
        eventId, userId, ParticipationDecision.parse(request.decision()), request.notes());
  }

  @PostMapping("/events/{eventId}/cancelled")
  public NotificationResult eventCancelled(
      @PathVariable("eventId") long eventId,
      @RequestBody(required = false) EventCancelledRequest request) {
    return orchestrator.notifyEventCancelled(eventId, request == null ? null : request.reason());
  }

  @PostMapping("/programmes/{programmeId}/changed")
  public NotificationResult programmeChanged(
      @PathVariable("programmeId") long programmeId,
      @RequestBody(required = false) ProgrammeChangedRequest request) {
    final ProgrammeChangeType changeType =
        ProgrammeChangeType.parse(request == null ? null : request.changeType());
    return orchestrator.notifyProgrammeChanged(programmeId, changeType);
  }

  @PostMapping("/works/{workId}/comments")
  public NotificationResult newComment(
      @PathVariable("workId") long workId, @Valid @RequestBody NewCommentRequest request) {
    return orchestrator.notifyNewComment(workId, request.authorId(), request.excerpt());
  }

  @PostMapping("/works/{workId}/favorites")
  public NotificationResult newFavorite(
      @PathVariable("workId") long workId, @Valid @RequestBody NewFavoriteRequest request) {
    return orchestrator.notifyNewFavorite(workId, request.userId());
  }

  @PostMapping("/works/{workId}/published")
  public NotificationResult newWork(@PathVariable("workId") long workId) {
    return orchestrator.notifyNewWork(workId);
  }

  @PostMapping("/users/{userId}/moderation")
  public NotificationResult moderation(
      @PathVariable("userId") long userId, @Valid @RequestBody ModerationRequest request) {
    return orchestrator.notifyModerationAction(
        userId, ModerationAction.parse(request.action()), request.workId(), request.reason());
  }

  @PostMapping("/users/{userId}/verification-reminder")
  public NotificationResult verificationReminder(@PathVariable("userId") long userId) {
    return orchestrator.remindEmailVerification(userId);
  }

  @PostMapping("/events/{eventId}/reminder")
  public NotificationResult eventReminder(@PathVariable("eventId") long eventId) {
    return orchestrator.sendEventReminder(eventId);
  }

  @PostMapping("/events/{eventId}/starting-soon")
  public NotificationResult eventStartingSoon(@PathVariable("eventId") long eventId) {
    return orchestrator.notifyEventStartingSoon(eventId);
  }

  @PostMapping("/events/{eventId}/published")
  public NotificationResult newEvent(
      @PathVariable("eventId") long eventId,
      @RequestParam(name = "region_only", defaultValue = "false") boolean regionOnly) {
    return orchestrator.notifyNewEvent(eventId, regionOnly);
  }

  @PostMapping("/newsletter")
  public NotificationResult newsletter() {
    return orchestrator.sendNewsletter();
  }
}
