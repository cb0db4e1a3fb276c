package com.ospicorp.modeltypes.config;

import com.ospicorp.modeltypes.jdbc.FieldMapDao;
import java.time.Clock;
import java.time.ZoneId;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.util.StringUtils;

@Configuration
public class ModelTypesConfig {

  private static final Logger log = LoggerFactory.getLogger(ModelTypesConfig.class);

  /**
   * Clock for {@code Date.today(Clock)} and {@code DateTime.now(Clock)}. The zone
   * comes from {@code modeltypes.zone}, the system zone when unset.
   */
  @Bean
  Clock modelTypesClock(@Value("${modeltypes.zone:}") String zone) {
    if (!StringUtils.hasText(zone)) {
      return Clock.systemDefaultZone();
    }
    log.info("Using time zone {} for model dates", zone);
    return Clock.system(ZoneId.of(zone.trim()));
  }

  @Bean
  FieldMapDao fieldMapDao(DataSource dataSource) {
    return new FieldMapDao(new NamedParameterJdbcTemplate(dataSource));
  }
}
