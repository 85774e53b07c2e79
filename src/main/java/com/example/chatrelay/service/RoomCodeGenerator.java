package com.example.chatrelay.service;

import com.example.chatrelay.config.ChatProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Locale;
import java.util.Random;

/** Random room codes: fixed length, uppercase base-36 ({@code 0-9A-Z}). */
@Component
public class RoomCodeGenerator {

    private final Random random;
    private final int length;

    @Autowired
    public RoomCodeGenerator(ChatProperties props) {
        this(new SecureRandom(), props.roomCode().length());
    }

    public RoomCodeGenerator(Random random, int length) {
        if (length <= 0) throw new IllegalArgumentException("length must be positive");
        this.random = random;
        this.length = length;
    }

    public String next() {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(Character.forDigit(random.nextInt(36), 36));
        }
        return sb.toString().toUpperCase(Locale.ROOT);
    }
}
