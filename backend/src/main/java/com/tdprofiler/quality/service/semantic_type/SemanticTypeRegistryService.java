package com.tdprofiler.quality.service.semantic_type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.PatternSyntaxException;

import org.springframework.stereotype.Service;

import com.tdprofiler.quality.config.ProfilerProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * Ordered table of semantic type rules. Built-in types come first, in priority order; custom
 * types from configuration follow them.
 */
@Slf4j
@Service
public class SemanticTypeRegistryService {

  public static final String EMAIL = "email";
  public static final String URL = "url";
  public static final String PHONE = "phone";
  public static final String ZIPCODE = "zipcode";

  static final List<SemanticTypeRule> BUILT_IN_RULES =
      List.of(
          SemanticTypeRule.of(EMAIL, "^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$"),
          SemanticTypeRule.of(URL, "^https?://(?:[-\\w.]|(?:%[\\da-fA-F]{2}))+"),
          SemanticTypeRule.of(PHONE, "^\\+?1?\\d{9,15}$"),
          SemanticTypeRule.of(ZIPCODE, "^\\d{5}(-\\d{4})?$"));

  private final List<SemanticTypeRule> rules;

  public SemanticTypeRegistryService(ProfilerProperties properties) {
    List<SemanticTypeRule> all = new ArrayList<>(BUILT_IN_RULES);
    for (ProfilerProperties.CustomSemanticType custom : properties.getCustomSemanticTypes()) {
      if (custom.getName() == null || custom.getPattern() == null) {
        throw new IllegalArgumentException("Custom semantic types need a name and a pattern");
      }
      if (all.stream().anyMatch(rule -> rule.getName().equals(custom.getName()))) {
        throw new IllegalArgumentException(
            "Semantic type '" + custom.getName() + "' is already defined");
      }
      try {
        all.add(SemanticTypeRule.of(custom.getName(), custom.getPattern()));
      } catch (PatternSyntaxException e) {
        throw new IllegalArgumentException(
            "Invalid pattern for semantic type '" + custom.getName() + "': " + e.getMessage(), e);
      }
      log.info("Registered custom semantic type '{}'", custom.getName());
    }
    this.rules = Collections.unmodifiableList(all);
  }

  public List<SemanticTypeRule> getRules() {
    return rules;
  }
}
