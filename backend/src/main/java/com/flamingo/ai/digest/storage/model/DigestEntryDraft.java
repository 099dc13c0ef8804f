package com.flamingo.ai.digest.storage.model;

import com.flamingo.ai.digest.domain.model.DigestSource;
import java.util.List;

/** One assembled digest paragraph before it is persisted. */
public record DigestEntryDraft(String title, String body, List<DigestSource> sources) {}
