package io.trail.jdbc;

import io.trail.model.Column;
import io.trail.model.ColumnType;
import io.trail.model.EntitySchema;
import io.trail.model.Filter;
import io.trail.util.JsonCodec;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Renders a {@link Filter} as a SQL condition over the columns of one entity table.
 */
final class FilterSql {

  record Fragment(String sql, List<Object> params) {
  }

  private FilterSql() {}

  /**
   * @throws IllegalArgumentException if the filter names an unknown or JSON column
   */
  static Fragment render(Filter filter, EntitySchema schema, JsonCodec codec) {
    List<Object> params = new ArrayList<>();
    String sql = render(filter, schema, codec, params);
    return new Fragment(sql, List.copyOf(params));
  }

  private static String render(Filter filter, EntitySchema schema, JsonCodec codec, List<Object> params) {
    if (filter instanceof Filter.All) {
      return "1=1";
    }
    if (filter instanceof Filter.Eq eq) {
      Column column = filterable(schema, eq.column());
      params.add(JdbcValues.toJdbc(column, eq.value(), codec));
      return column.name() + " = ?";
    }
    if (filter instanceof Filter.In in) {
      Column column = filterable(schema, in.column());
      if (in.values().isEmpty()) {
        return "1=0";
      }
      StringJoiner markers = new StringJoiner(", ", column.name() + " IN (", ")");
      for (Object value : in.values()) {
        params.add(JdbcValues.toJdbc(column, value, codec));
        markers.add("?");
      }
      return markers.toString();
    }
    if (filter instanceof Filter.IsNull isNull) {
      return filterable(schema, isNull.column()).name() + " IS NULL";
    }
    StringJoiner conjunction = new StringJoiner(" AND ", "(", ")");
    for (Filter part : ((Filter.And) filter).filters()) {
      conjunction.add(render(part, schema, codec, params));
    }
    return conjunction.toString();
  }

  private static Column filterable(EntitySchema schema, String name) {
    Column column = schema.requireColumn(name);
    if (column.type() == ColumnType.JSON) {
      throw new IllegalArgumentException("Cannot filter on JSON column " + name);
    }
    return column;
  }
}
