package io.trail.jdbc;

import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.util.UUID;

class H2TrailIntegrationTest extends AbstractTrailIntegrationTest {

  @Override
  DataSource prepareDatabase() throws Exception {
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:trail_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    SqlScripts.createAll(dataSource, "h2");
    return dataSource;
  }
}
