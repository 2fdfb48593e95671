/*
 * Copyright Columnar Compute Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.columnar.compute.expression.predicate;

import java.util.regex.Pattern;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Glob match of a string column. {@code *} matches any run of characters and {@code ?} matches
 * exactly one.
 */
@EqualsAndHashCode(exclude = "pattern")
public class Like implements Predicate {

  @Getter private final String column;
  @Getter private final String glob;
  private final Pattern pattern;

  public Like(String column, String glob) {
    this.column = column;
    this.glob = glob;
    this.pattern = toPattern(glob);
  }

  static Pattern toPattern(String glob) {
    StringBuilder regex = new StringBuilder();
    StringBuilder literal = new StringBuilder();
    for (char c : glob.toCharArray()) {
      if (c == '*' || c == '?') {
        if (literal.length() > 0) {
          regex.append(Pattern.quote(literal.toString()));
          literal.setLength(0);
        }
        regex.append(c == '*' ? ".*" : ".");
      } else {
        literal.append(c);
      }
    }
    if (literal.length() > 0) {
      regex.append(Pattern.quote(literal.toString()));
    }
    return Pattern.compile(regex.toString(), Pattern.DOTALL);
  }

  @Override
  public boolean test(Object element) {
    Object value = ElementAccess.read(element, column);
    return value instanceof String && pattern.matcher((String) value).matches();
  }

  @Override
  public <R, E extends Exception> R accept(PredicateVisitor<R, E> visitor) throws E {
    return visitor.visitLike(this);
  }

  @Override
  public String toString() {
    return ElementAccess.describe(column) + " like '" + glob + "'";
  }
}
