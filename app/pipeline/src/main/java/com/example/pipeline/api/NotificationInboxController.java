/*
 * どこで: 通知受信箱 API
 * 何を: ユーザーの通知一覧・未読件数・既読化を提供する
 * なぜ: 通知行が受ける変更は既読化だけに限定するため
 */
package com.example.pipeline.api;

import com.example.pipeline.notification.NotificationRepository;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/notifications/{userId}")
@RequiredArgsConstructor
@Validated
public class NotificationInboxController {

  private final NotificationRepository notificationRepository;
  private final Clock clock;

  @GetMapping
  public NotificationInboxResponse list(
      @PathVariable("userId") long userId,
      @RequestParam(name = "limit", defaultValue = "20")
          @Min(value = 1, message = "limit must be at least 1")
          @Max(value = 100, message = "limit must be at most 100")
          int limit,
      @RequestParam(name = "offset", defaultValue = "0")
          @Min(value = 0, message = "offset must not be negative")
          int offset,
      @RequestParam(name = "unread", defaultValue = "false") boolean unreadOnly) {
    final List<NotificationView> items =
        notificationRepository.findByUser(userId, limit, offset, unreadOnly).stream()
            .map(NotificationView::from)
            .toList();
    final long total = notificationRepository.countByUser(userId, unreadOnly);
    return new NotificationInboxResponse(userId, total, limit, offset, items);
  }

  @GetMapping("/unread-count")
  public UnreadCountResponse unreadCount(@PathVariable("userId") long userId) {
    return new UnreadCountResponse(userId, notificationRepository.countByUser(userId, true));
  }

  @PostMapping("/read")
  public MarkReadResponse markRead(
      @PathVariable("userId") long userId,
      @RequestBody(required = false) MarkReadRequest request) {
    final Instant now = Instant.now(clock);
    final int updated =
        request == null || request.notificationIds().isEmpty()
            ? notificationRepository.markAllRead(userId, now)
            : notificationRepository.markRead(userId, request.notificationIds(), now);
    return new MarkReadResponse(userId, updated);
  }
}
