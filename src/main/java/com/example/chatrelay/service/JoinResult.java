package com.example.chatrelay.service;

public enum JoinResult {
    JOINED,
    ROOM_FULL
}
