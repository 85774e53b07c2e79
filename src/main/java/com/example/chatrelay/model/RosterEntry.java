package com.example.chatrelay.model;

/** Broadcast-safe roster row. {@code id} is for display only, never a routing key. */
public record RosterEntry(String id, String username) { }
