package com.example.pipeline.orchestrator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * What to render: a message key prefix, its arguments and an optional free-text note.
 *
 * <p>Arguments may be {@link java.time.Instant} or {@link
 * com.example.pipeline.platform.LocalizedText}; the renderer formats both for the recipient.
 */
public record MessageSpec(String key, List<Object> args, String note, String actionUrl) {

  public MessageSpec {
    // null 引数は許容し、空文字として描画する
    args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
  }

  public static MessageSpec of(String key, Object... args) {
    return new MessageSpec(key, Arrays.asList(args), null, null);
  }

  public MessageSpec withNote(String value) {
    return new MessageSpec(key, args, value, actionUrl);
  }

  public MessageSpec withActionUrl(String value) {
    return new MessageSpec(key, args, note, value);
  }
}
