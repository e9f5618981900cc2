/*
 * Where: Notification web configuration
 * What: Applies RequestMdcInterceptor to every request
 * Why: Request identifiers must be present in every API log line
 */
package com.worshipteam.notification.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor);
  }
}
