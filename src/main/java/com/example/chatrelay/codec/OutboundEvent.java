package com.example.chatrelay.codec;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record OutboundEvent(String event, Long ackId, Object data) { }
