package com.example.pipeline.channel;

public record EmailAttachment(String filename, String contentType, String contentBase64) {}
