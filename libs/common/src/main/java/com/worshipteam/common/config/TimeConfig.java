/*
 * Where: common configuration
 * What: Exposes the application Clock as an injectable bean
 * Why: Reminder windows and device timestamps must be testable with a fixed clock
 */
package com.worshipteam.common.config;

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
