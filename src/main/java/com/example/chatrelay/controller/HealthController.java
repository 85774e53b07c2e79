package com.example.chatrelay.controller;

import com.example.chatrelay.service.ChatService;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

  private final ChatService chatService;

  public HealthController(ChatService chatService) {
    this.chatService = chatService;
  }

  /** Liveness probe. */
  @GetMapping("/healthz")
  public String healthz() {
    return "ok";
  }

  /** Status with the live room count; no room contents. */
  @GetMapping("/health")
  public Map<String, Object> health() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("status", "ok");
    m.put("rooms", chatService.liveRoomCount());
    return m;
  }
}
