package com.example.dutyroster.constraint;

public record Elimination(EliminationReason reason, String detail) {

    public Elimination {
        if (reason == null) {
            throw new IllegalArgumentException("reason is required");
        }
    }

    public static Elimination of(EliminationReason reason, String detail) {
        return new Elimination(reason, detail);
    }

    @Override
    public String toString() {
        return detail == null ? reason.name() : reason + "(" + detail + ")";
    }
}
