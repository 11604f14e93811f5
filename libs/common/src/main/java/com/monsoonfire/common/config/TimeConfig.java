/*
 * Where: common configuration
 * What: Exposes the Clock as an injectable bean
 * Why: Services share one time source that tests can replace with a fixed clock
 */
package com.monsoonfire.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
