package com.RetailCore.pos_backend.security;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.UUID;

@Data
@AllArgsConstructor
public class Actor {
    public static final Actor SYSTEM = new Actor(new UUID(0L, 0L), "SYSTEM");

    private UUID id;
    private String name;
}
