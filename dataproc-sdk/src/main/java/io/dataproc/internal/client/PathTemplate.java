package io.dataproc.internal.client;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resource name template such as {@code projects/{project}/locations/{location}}. Variables match
 * any non empty text.
 */
public final class PathTemplate {
  private static final Pattern VARIABLE = Pattern.compile("\\{(\\w+)}");

  private final String template;
  private final List<String> variables;
  private final Pattern pattern;

  private PathTemplate(String template) {
    ImmutableList.Builder<String> variables = ImmutableList.builder();
    StringBuilder regex = new StringBuilder("^");
    Matcher m = VARIABLE.matcher(template);
    int last = 0;
    while (m.find()) {
      regex.append(Pattern.quote(template.substring(last, m.start()))).append("(.+?)");
      variables.add(m.group(1));
      last = m.end();
    }
    regex.append(Pattern.quote(template.substring(last))).append("$");
    this.template = template;
    this.variables = variables.build();
    this.pattern = Pattern.compile(regex.toString());
  }

  public static PathTemplate of(String template) {
    return new PathTemplate(template);
  }

  /**
   * @param values one per variable, in template order
   * @throws IllegalArgumentException if the number of values doesn't match the template
   */
  public String instantiate(String... values) {
    Preconditions.checkArgument(
        values.length == variables.size(),
        "%s expects %s values, got %s",
        template,
        variables.size(),
        values.length);
    StringBuilder result = new StringBuilder();
    Matcher m = VARIABLE.matcher(template);
    int last = 0;
    int i = 0;
    while (m.find()) {
      result
          .append(template, last, m.start())
          .append(Preconditions.checkNotNull(values[i], variables.get(i)));
      i++;
      last = m.end();
    }
    return result.append(template.substring(last)).toString();
  }

  /** @return variable values keyed by variable name, empty if {@code path} doesn't match */
  public Map<String, String> match(String path) {
    if (path == null) {
      return Collections.emptyMap();
    }
    Matcher m = pattern.matcher(path);
    if (!m.matches()) {
      return Collections.emptyMap();
    }
    ImmutableMap.Builder<String, String> result = ImmutableMap.builder();
    for (int i = 0; i < variables.size(); i++) {
      result.put(variables.get(i), m.group(i + 1));
    }
    return result.build();
  }

  @Override
  public String toString() {
    return template;
  }
}
