package com.example.pipeline.queue.processor;

import com.example.pipeline.channel.EmailMessage;
import com.example.pipeline.notification.PendingNotification;

/** One campaign email; {@code history} is null for recipients without an in-app row. */
public record BulkRecipient(EmailMessage email, PendingNotification history) {}
