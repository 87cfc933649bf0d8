package com.techStack.authCore.models;

import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

@Getter
public enum TokenKind {
    ACCESS("access"),
    REFRESH("refresh");

    private final String value;

    TokenKind(String value) {
        this.value = value;
    }

    public static Optional<TokenKind> fromValue(String value) {
        return Arrays.stream(values())
                .filter(kind -> kind.value.equals(value))
                .findFirst();
    }
}
