package com.example.pipeline.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.pipeline.channel.EmailMessage;
import com.example.pipeline.config.DeliveryProperties;
import com.example.pipeline.config.DeliveryProperties.JobDefaults;
import com.example.pipeline.notification.NotificationPriority;
import com.example.pipeline.notification.NotificationType;
import com.example.pipeline.notification.PendingNotification;
import com.example.pipeline.queue.BackoffType;
import com.example.pipeline.queue.BulkEnqueueResult;
import com.example.pipeline.queue.JobHandle;
import com.example.pipeline.queue.JobQueue;
import com.example.pipeline.queue.QueueUnavailableException;
import com.example.pipeline.queue.processor.BulkEmailJobProcessor;
import com.example.pipeline.queue.processor.BulkRecipient;
import com.example.pipeline.queue.processor.NotificationJobPayload;
import com.example.pipeline.queue.processor.NotificationJobProcessor;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class QueueBackedDeliveryTest {

  @Mock private JobQueue jobQueue;

  private QueueBackedDelivery delivery;

  @BeforeEach
  void setUp() {
    final JobDefaults defaults =
        new JobDefaults(3, BackoffType.EXPONENTIAL, Duration.ofSeconds(5), false);
    delivery =
        new QueueBackedDelivery(
            jobQueue,
            new DeliveryProperties(
                100,
                Duration.ofMillis(100),
                defaults,
                defaults,
                new JobDefaults(3, BackoffType.FIXED, Duration.ofSeconds(10), false)));
  }

  @Test
  void transactionalEmailGoesToTheEmailQueueAndIsReportedAsQueued() {
    final EmailMessage email = EmailMessage.of("user@example.dz", "Participation", "texte", null);
    final PendingNotification history =
        PendingNotification.of(
            4L,
            NotificationType.PARTICIPATION_DECISION,
            "Participation acceptée",
            "Votre participation a été acceptée",
            9L,
            null,
            null,
            "/evenements/9",
            NotificationPriority.HIGH);
    when(jobQueue.enqueue(eq("email"), eq(NotificationJobProcessor.JOB_TYPE), any(), any()))
        .thenReturn(new JobHandle(UUID.randomUUID(), "email"));

    final DeliveryOutcome outcome =
        delivery.deliver(
            new OutboundMessage(
                4L, NotificationType.PARTICIPATION_DECISION, email, null, null, history));

    assertThat(outcome).isEqualTo(DeliveryOutcome.queuedForDelivery());
    assertThat(outcome.emailSent()).isFalse();
    final ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
    verify(jobQueue)
        .enqueue(eq("email"), eq(NotificationJobProcessor.JOB_TYPE), payload.capture(), any());
    assertThat(payload.getValue())
        .isEqualTo(
            new NotificationJobPayload(
                4L, "validation_participation", email, null, null, history));
  }

  @Test
  void inAppOnlyMessageIsNotEnqueued() {
    final DeliveryOutcome outcome =
        delivery.deliver(new OutboundMessage(4L, NotificationType.NEW_FAVORITE, null, null, null));

    assertThat(outcome).isEqualTo(DeliveryOutcome.inAppOnly());
    verifyNoInteractions(jobQueue);
  }

  @Test
  void emailWithSmsGoesToTheNotificationQueue() {
    final EmailMessage email = EmailMessage.of("user@example.dz", "Annulation", "texte", null);
    when(jobQueue.enqueue(eq("notification"), eq(NotificationJobProcessor.JOB_TYPE), any(), any()))
        .thenReturn(new JobHandle(UUID.randomUUID(), "notification"));

    delivery.deliver(
        new OutboundMessage(4L, NotificationType.EVENT_CANCELLED, email, "0550000000", "annule"));

    final ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
    verify(jobQueue)
        .enqueue(eq("notification"), eq(NotificationJobProcessor.JOB_TYPE), payload.capture(), any());
    assertThat(payload.getValue())
        .isEqualTo(
            new NotificationJobPayload(
                4L, "annulation_evenement", email, "0550000000", "annule", null));
  }

  @Test
  void enqueueFailurePropagates() {
    when(jobQueue.enqueue(any(), any(), any(), any()))
        .thenThrow(new QueueUnavailableException("job queue is not running"));

    assertThatThrownBy(
            () ->
                delivery.deliver(
                    new OutboundMessage(
                        4L,
                        NotificationType.PARTICIPATION_DECISION,
                        EmailMessage.of("user@example.dz", "s", "t", null),
                        null,
                        null)))
        .isInstanceOf(QueueUnavailableException.class);
  }

  @Test
  void bulkEnqueuesOnlyEmailRecipients() {
    when(jobQueue.enqueueBulk(
            eq("bulk"), eq(BulkEmailJobProcessor.JOB_TYPE), any(), anyInt(), any(), any()))
        .thenReturn(new BulkEnqueueResult(List.of(UUID.randomUUID()), 1, 1));

    final List<DeliveryOutcome> outcomes =
        delivery.deliverBulk(
            "newsletter-1",
            List.of(
                new OutboundMessage(
                    1L,
                    NotificationType.NEWSLETTER,
                    EmailMessage.of("a@example.dz", "s", "t", null),
                    null,
                    null),
                new OutboundMessage(2L, NotificationType.NEWSLETTER, null, null, null)));

    assertThat(outcomes)
        .containsExactly(DeliveryOutcome.queuedForDelivery(), DeliveryOutcome.inAppOnly());
    verify(jobQueue)
        .enqueueBulk(
            eq("bulk"),
            eq(BulkEmailJobProcessor.JOB_TYPE),
            eq(List.of(new BulkRecipient(EmailMessage.of("a@example.dz", "s", "t", null), null))),
            eq(100),
            any(),
            any());
  }
}
