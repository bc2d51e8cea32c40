package com.blogflow.backend.integration.ai;

import java.util.List;

/** Shape the analysis model is asked to reply with. */
public record AnalysisReply(String topic, String summary, List<String> tags) {}
