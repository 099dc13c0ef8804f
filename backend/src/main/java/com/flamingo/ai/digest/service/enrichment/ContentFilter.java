package com.flamingo.ai.digest.service.enrichment;

import com.flamingo.ai.digest.config.PipelineConfig;
import com.flamingo.ai.digest.storage.model.ClaimedMessage;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Configurable content filters: forwarded-message suppression, minimum length, ad keywords, and
 * deny/allow patterns. Patterns and keywords match as case-insensitive substrings.
 *
 * <p>Mode {@code denylist} applies only deny patterns, {@code allowlist} only allow patterns, and
 * {@code mixed} applies both. An allow list with no entries lets everything through.
 */
@Component
@RequiredArgsConstructor
public class ContentFilter implements MessageFilter {

  public static final String REASON_FORWARDED = "forwarded";
  public static final String REASON_MIN_LENGTH = "filter_min_length";
  public static final String REASON_ADS = "filter_ads";
  public static final String REASON_DENY = "filter_deny";
  public static final String REASON_ALLOW_MISS = "filter_allow_miss";

  private static final String MODE_MIXED = "mixed";
  private static final String MODE_ALLOWLIST = "allowlist";
  private static final String MODE_DENYLIST = "denylist";

  private final PipelineConfig pipelineConfig;

  @Override
  public FilterDecision evaluate(ClaimedMessage message) {
    PipelineConfig.Filter filter = pipelineConfig.getFilter();
    if (filter.isSuppressForwards() && message.forwarded()) {
      return FilterDecision.reject(REASON_FORWARDED);
    }

    String text = message.text() == null ? "" : message.text();
    if (filter.getMinLength() > 0
        && text.codePointCount(0, text.length()) < filter.getMinLength()) {
      return FilterDecision.reject(REASON_MIN_LENGTH);
    }

    String lower = text.toLowerCase(Locale.ROOT);
    if (filter.isAdsEnabled() && containsAny(lower, filter.getAdsKeywords())) {
      return FilterDecision.reject(REASON_ADS);
    }

    String mode = filter.getMode() == null ? MODE_MIXED : filter.getMode().toLowerCase(Locale.ROOT);
    boolean applyDeny = MODE_MIXED.equals(mode) || MODE_DENYLIST.equals(mode);
    boolean applyAllow = MODE_MIXED.equals(mode) || MODE_ALLOWLIST.equals(mode);

    if (applyDeny && containsAny(lower, filter.getDenyPatterns())) {
      return FilterDecision.reject(REASON_DENY);
    }
    if (applyAllow
        && !filter.getAllowPatterns().isEmpty()
        && !containsAny(lower, filter.getAllowPatterns())) {
      return FilterDecision.reject(REASON_ALLOW_MISS);
    }
    return FilterDecision.pass();
  }

  private static boolean containsAny(String lowerText, List<String> needles) {
    for (String needle : needles) {
      if (needle != null && !needle.isBlank()
          && lowerText.contains(needle.toLowerCase(Locale.ROOT))) {
        return true;
      }
    }
    return false;
  }
}
