package com.tdprofiler.quality.service.semantic_type;

import java.util.regex.Pattern;

import lombok.Value;

/**
 * A named regular expression. Values are matched from their first character only, so a pattern
 * without a trailing {@code $} accepts any value it is a prefix of.
 */
@Value
public class SemanticTypeRule {

  String name;
  Pattern pattern;

  public static SemanticTypeRule of(String name, String regex) {
    return new SemanticTypeRule(name, Pattern.compile(regex));
  }

  public boolean matches(String value) {
    return value != null && pattern.matcher(value).lookingAt();
  }
}
