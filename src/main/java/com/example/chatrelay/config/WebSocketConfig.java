package com.example.chatrelay.config;

import com.example.chatrelay.handler.ChatWebSocketHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import java.util.*;
import java.util.stream.Collectors;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

  private static final Logger log = LoggerFactory.getLogger(WebSocketConfig.class);

  private final ChatWebSocketHandler handler;
  private final String wsPath;
  private final List<String> originPatterns;

  public WebSocketConfig(ChatWebSocketHandler handler, ChatProperties props) {
    this.handler = handler;
    this.wsPath = props.websocket().path();
    this.originPatterns = toPatterns(props.websocket().allowedOrigins());
  }

  /** CSV -> origin patterns; an empty list means same-origin only. */
  static List<String> toPatterns(String originsCsv) {
    if (originsCsv == null) return Collections.emptyList();
    return Arrays.stream(originsCsv.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .flatMap(s -> expandToPatterns(s).stream())
        .distinct()
        .collect(Collectors.toList());
  }

  // Expand a few helpful variants into patterns (esp. localhost)
  private static List<String> expandToPatterns(String origin) {
    List<String> out = new ArrayList<>();
    if ("*".equals(origin)) { out.add("*"); return out; }
    out.add(origin);
    if (origin.startsWith("http://localhost:")) {
      out.add("http://127.0.0.1:" + origin.substring("http://localhost:".length()));
    }
    return out;
  }

  @Override
  public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
    log.info("Registering chat endpoint path={} origins={}", wsPath, originPatterns);
    registry.addHandler(handler, wsPath)
            .setAllowedOriginPatterns(originPatterns.toArray(String[]::new));
  }
}
