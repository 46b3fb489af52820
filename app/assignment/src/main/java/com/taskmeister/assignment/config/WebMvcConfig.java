/*
 * どこで: Assignment Web 設定
 * 何を: RequestMdcInterceptor を /v1 配下の API にだけ適用する
 * なぜ: actuator などの運用エンドポイントを除き、API 操作のログへ運用キーを埋め込むため
 */
package com.taskmeister.assignment.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

  static final String API_PATH_PATTERN = "/v1/**";

  @Bean
  public RequestMdcInterceptor requestMdcInterceptor() {
    return new RequestMdcInterceptor();
  }

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor()).addPathPatterns(API_PATH_PATTERN);
  }
}
