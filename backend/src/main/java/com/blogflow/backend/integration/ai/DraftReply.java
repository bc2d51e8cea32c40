package com.blogflow.backend.integration.ai;

public record DraftReply(String title, String body) {}
