package com.chicu.ecorisk.domain;

public enum Species {

    PLANTS("plants"),
    HERBIVORES("herbivores"),
    CARNIVORES("carnivores");

    private final String key;

    Species(String key) {
        this.key = key;
    }

    /** Ключ в JSON-ответах */
    public String key() {
        return key;
    }
}
