package io.trail.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Declarative row predicate for bulk operations. Storage modules render it, the core only
 * passes it through.
 */
public sealed interface Filter permits Filter.All, Filter.Eq, Filter.In, Filter.IsNull, Filter.And {

  static Filter all() {
    return All.INSTANCE;
  }

  static Filter eq(String column, Object value) {
    return new Eq(column, value);
  }

  static Filter in(String column, Collection<?> values) {
    return new In(column, List.copyOf(values));
  }

  static Filter isNull(String column) {
    return new IsNull(column);
  }

  static Filter and(Filter... filters) {
    return new And(Arrays.asList(filters));
  }

  /** Matches every row. */
  enum All implements Filter {
    INSTANCE
  }

  record Eq(String column, Object value) implements Filter {
    public Eq {
      Objects.requireNonNull(column, "column");
      Objects.requireNonNull(value, "value (use isNull for null checks)");
    }
  }

  record In(String column, List<?> values) implements Filter {
    public In {
      Objects.requireNonNull(column, "column");
      values = List.copyOf(values);
    }
  }

  record IsNull(String column) implements Filter {
    public IsNull {
      Objects.requireNonNull(column, "column");
    }
  }

  record And(List<Filter> filters) implements Filter {
    public And {
      filters = List.copyOf(filters);
      if (filters.isEmpty()) {
        throw new IllegalArgumentException("and() requires at least one filter");
      }
    }
  }
}
