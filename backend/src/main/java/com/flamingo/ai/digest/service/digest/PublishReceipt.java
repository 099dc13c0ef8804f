package com.flamingo.ai.digest.service.digest;

/** Where the transport delivered a digest. */
public record PublishReceipt(String chatId, String messageId) {}
