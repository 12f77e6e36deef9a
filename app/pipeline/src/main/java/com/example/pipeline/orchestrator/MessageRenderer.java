/*
 * どこで: 通知オーケストレータ
 * 何を: ロケールとロールごとにメッセージバンドルからタイトル・本文・メール・SMS を生成する
 * なぜ: 受信者が自分の言語で読み、専門家向けには専用の文面を使うため
 */
package com.example.pipeline.orchestrator;

import com.example.pipeline.config.PlatformProperties;
import com.example.pipeline.platform.LocalizedText;
import com.example.pipeline.platform.Recipient;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.FormatStyle;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.context.MessageSource;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

/**
 * Looks up {@code <key>.title}, {@code <key>.body} and {@code <key>.sms}. For the body a
 * role-specific {@code <key>.body.<role>} wins when the bundle defines it.
 */
@Component
@RequiredArgsConstructor
public class MessageRenderer {

  private final MessageSource messageSource;
  private final PlatformProperties platformProperties;

  public RenderedMessage render(MessageSpec spec, Recipient recipient) {
    final Locale locale = recipient.locale();
    final Object[] args = formatArgs(spec, locale);
    final String title = message(spec.key() + ".title", args, locale);
    final String roleBody =
        messageSource.getMessage(
            spec.key() + ".body." + recipient.role().key(), args, null, locale);
    String body = roleBody != null ? roleBody : message(spec.key() + ".body", args, locale);
    if (spec.note() != null && !spec.note().isBlank()) {
      body = body + "\n" + message("common.note", new Object[] {spec.note().trim()}, locale);
    }
    final String sms = messageSource.getMessage(spec.key() + ".sms", args, null, locale);
    final String greeting =
        message("email.greeting", new Object[] {recipient.displayName()}, locale);
    final String footer = message("email.footer", new Object[0], locale);
    final String actionUrl = absoluteUrl(spec.actionUrl());
    return new RenderedMessage(
        title,
        body,
        message("email.subject", new Object[] {title}, locale),
        emailText(greeting, body, actionUrl, footer, locale),
        emailHtml(title, greeting, body, actionUrl, footer, locale),
        sms);
  }

  /** Formats an instant the way the recipient's locale writes dates, in the platform zone. */
  public String formatInstant(Instant instant, Locale locale) {
    if (instant == null) {
      return "";
    }
    return DateTimeFormatter.ofLocalizedDateTime(FormatStyle.MEDIUM, FormatStyle.SHORT)
        .withLocale(locale)
        .withZone(platformProperties.zone())
        .format(instant);
  }

  private Object[] formatArgs(MessageSpec spec, Locale locale) {
    return spec.args().stream()
        .map(
            arg -> {
              if (arg == null) {
                return "";
              }
              if (arg instanceof Instant instant) {
                return formatInstant(instant, locale);
              }
              if (arg instanceof LocalizedText text) {
                return text.resolve(locale);
              }
              return arg;
            })
        .toArray();
  }

  private String message(String key, Object[] args, Locale locale) {
    return messageSource.getMessage(key, args, locale);
  }

  private String absoluteUrl(String path) {
    if (path == null || path.isBlank()) {
      return null;
    }
    return path.startsWith("http") ? path : platformProperties.link(path);
  }

  private String emailText(
      String greeting, String body, String actionUrl, String footer, Locale locale) {
    final StringBuilder text = new StringBuilder();
    text.append(greeting).append("\n\n").append(body).append("\n\n");
    if (actionUrl != null) {
      text.append(message("email.cta", new Object[0], locale)).append(": ").append(actionUrl);
      text.append("\n\n");
    }
    return text.append(footer).toString();
  }

  private String emailHtml(
      String title, String greeting, String body, String actionUrl, String footer, Locale locale) {
    final String direction = "ar".equals(locale.getLanguage()) ? "rtl" : "ltr";
    final StringBuilder html = new StringBuilder();
    html.append("<!DOCTYPE html><html lang=\"")
        .append(escape(locale.getLanguage()))
        .append("\" dir=\"")
        .append(direction)
        .append("\"><body>");
    html.append("<h2>").append(escape(title)).append("</h2>");
    html.append("<p>").append(escape(greeting)).append("</p>");
    html.append("<p>").append(escapeMultiline(body)).append("</p>");
    if (actionUrl != null) {
      html.append("<p><a href=\"")
          .append(escape(actionUrl))
          .append("\">")
          .append(escape(message("email.cta", new Object[0], locale)))
          .append("</a></p>");
    }
    html.append("<p><small>").append(escape(footer)).append("</small></p>");
    return html.append("</body></html>").toString();
  }

  private static String escapeMultiline(String text) {
    return escape(text).replace("\n", "<br>");
  }

  // 記号のみエスケープし、アクセント付き文字やアラビア文字は UTF-8 のまま残す
  private static String escape(String text) {
    return HtmlUtils.htmlEscape(text, "UTF-8");
  }
}
