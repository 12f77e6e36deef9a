/*
 * どこで: Job processor（email queue）
 * 何を: 1 job につきメールを 1 通送る
 * なぜ: トランザクションメールを元のリクエストと独立に retry するため
 */
package com.example.pipeline.queue.processor;

import com.example.pipeline.channel.DeliveryChannel;
import com.example.pipeline.channel.DeliveryFailedException;
import com.example.pipeline.channel.DeliveryResult;
import com.example.pipeline.channel.EmailMessage;
import com.example.pipeline.queue.JobContext;
import com.example.pipeline.queue.JobProcessor;
import com.example.pipeline.queue.PermanentJobFailureException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EmailJobProcessor implements JobProcessor {

  public static final String JOB_TYPE = "send-email";

  private static final Logger logger = LoggerFactory.getLogger(EmailJobProcessor.class);

  private final DeliveryChannel deliveryChannel;
  private final ObjectMapper objectMapper;

  @Override
  public DeliveryResult process(JobContext context) throws JsonProcessingException {
    final EmailMessage message = objectMapper.treeToValue(context.payload(), EmailMessage.class);
    if (!message.hasValidRecipient()) {
      throw new PermanentJobFailureException("invalid recipient address to=" + message.to());
    }
    final DeliveryResult result = deliveryChannel.sendEmail(message);
    if (!result.success()) {
      throw new DeliveryFailedException(
          "email delivery failed to=" + message.to() + " error=" + result.error());
    }
    logger.info(
        "email job sent jobId={} attempt={} messageId={}",
        context.jobId(),
        context.attempt(),
        result.messageId());
    return result;
  }
}
