package com.example.pipeline.queue.processor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.pipeline.channel.DeliveryChannel;
import com.example.pipeline.channel.DeliveryFailedException;
import com.example.pipeline.channel.DeliveryResult;
import com.example.pipeline.channel.EmailMessage;
import com.example.pipeline.notification.NotificationPriority;
import com.example.pipeline.notification.NotificationType;
import com.example.pipeline.notification.PendingNotification;
import com.example.pipeline.queue.JobContext;
import com.example.pipeline.queue.PermanentJobFailureException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationJobProcessorTest {

  private static final PendingNotification HISTORY =
      PendingNotification.of(
          7L,
          NotificationType.EVENT_CANCELLED,
          "Événement annulé",
          "Le concert est annulé",
          4L,
          null,
          null,
          "/evenements/4",
          NotificationPriority.HIGH);

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Mock private DeliveryChannel deliveryChannel;
  @Mock private DeliveryHistoryRecorder historyRecorder;

  private NotificationJobProcessor processor;

  @BeforeEach
  void setUp() {
    processor = new NotificationJobProcessor(deliveryChannel, objectMapper, historyRecorder);
  }

  @Test
  void sendsEmailThenSmsAndRecordsBoth() throws Exception {
    final EmailMessage email = EmailMessage.of("user@example.dz", "Annulation", "texte", null);
    when(deliveryChannel.sendEmail(email)).thenReturn(DeliveryResult.sent("e-1"));
    when(deliveryChannel.sendSms("0550000000", "annule")).thenReturn(DeliveryResult.sent("s-1"));

    final Map<String, Object> result =
        processor.process(
            context(
                new NotificationJobPayload(
                    7L, "annulation_evenement", email, "0550000000", "annule", HISTORY),
                1));

    assertThat(result).containsEntry("emailMessageId", "e-1").containsEntry("smsMessageId", "s-1");
    verify(historyRecorder).record(HISTORY, true, true);
  }

  @Test
  void smsFailureIsRecordedWithoutFailingTheJob() throws Exception {
    when(deliveryChannel.sendSms(any(), any())).thenReturn(DeliveryResult.failure("no credit"));

    final Map<String, Object> result =
        processor.process(
            context(
                new NotificationJobPayload(
                    7L, "rappel_evenement", null, "0550000000", "demain", HISTORY),
                1));

    assertThat(result).containsEntry("smsError", "no credit");
    verify(historyRecorder).record(HISTORY, false, false);
  }

  @Test
  void emailFailureWithAttemptsLeftIsRetriedWithoutARow() {
    when(deliveryChannel.sendEmail(any())).thenReturn(DeliveryResult.failure("timeout"));

    assertThatThrownBy(() -> processor.process(context(cancellation(), 1)))
        .isInstanceOf(DeliveryFailedException.class);
    verify(deliveryChannel, never()).sendSms(any(), any());
    verify(historyRecorder, never()).record(any(), anyBoolean(), anyBoolean());
  }

  @Test
  void emailFailureOnTheLastAttemptRecordsTheRowAsNotSent() {
    when(deliveryChannel.sendEmail(any())).thenReturn(DeliveryResult.failure("provider outage"));

    assertThatThrownBy(() -> processor.process(context(cancellation(), 3)))
        .isInstanceOf(DeliveryFailedException.class)
        .hasMessageContaining("provider outage");
    verify(historyRecorder).record(HISTORY, false, false);
  }

  @Test
  void channelExceptionCountsAsAFailedSend() {
    when(deliveryChannel.sendEmail(any())).thenThrow(new IllegalStateException("connection reset"));

    assertThatThrownBy(() -> processor.process(context(cancellation(), 3)))
        .isInstanceOf(DeliveryFailedException.class)
        .hasMessageContaining("connection reset");
    verify(historyRecorder).record(HISTORY, false, false);
  }

  @Test
  void invalidRecipientRecordsTheRowAndFailsPermanently() {
    final NotificationJobPayload payload =
        new NotificationJobPayload(
            7L,
            "annulation_evenement",
            EmailMessage.of("not-an-address", "s", "t", null),
            null,
            null,
            HISTORY);

    assertThatThrownBy(() -> processor.process(context(payload, 1)))
        .isInstanceOf(PermanentJobFailureException.class);
    verify(deliveryChannel, never()).sendEmail(any());
    verify(historyRecorder).record(HISTORY, false, false);
  }

  private NotificationJobPayload cancellation() {
    return new NotificationJobPayload(
        7L,
        "annulation_evenement",
        EmailMessage.of("user@example.dz", "s", "t", null),
        "0550000000",
        "annule",
        HISTORY);
  }

  private JobContext context(NotificationJobPayload payload, int attempt) {
    return new JobContext(
        UUID.randomUUID(),
        "notification",
        NotificationJobProcessor.JOB_TYPE,
        objectMapper.valueToTree(payload),
        attempt,
        3,
        percent -> {});
  }
}
