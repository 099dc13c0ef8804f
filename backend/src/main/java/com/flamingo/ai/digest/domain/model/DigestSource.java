package com.flamingo.ai.digest.domain.model;

/** Reference to the channel message a digest entry was built from. */
public record DigestSource(String channel, long msgId) {}
