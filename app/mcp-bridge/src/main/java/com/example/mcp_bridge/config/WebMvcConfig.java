/*
 * どこで: MCP Bridge Web 設定
 * 何を: RequestMdcInterceptor を全リクエストへ適用する
 * なぜ: 認可フローと MCP 呼び出しのログへ request_id とセッション ID を載せるため
 */
package com.example.mcp_bridge.config;

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
