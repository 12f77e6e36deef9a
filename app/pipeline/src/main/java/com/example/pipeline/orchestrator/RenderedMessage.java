package com.example.pipeline.orchestrator;

/** One notification rendered for one recipient in the recipient's language. */
public record RenderedMessage(
    String title, String body, String emailSubject, String emailText, String emailHtml, String smsText) {}
