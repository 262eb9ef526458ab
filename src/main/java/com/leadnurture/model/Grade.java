package com.leadnurture.model;

public enum Grade {
    A(85),
    B(70),
    C(50),
    D(30),
    F(0);

    private final int threshold;

    Grade(int threshold) {
        this.threshold = threshold;
    }

    public int getThreshold() {
        return threshold;
    }

    public static Grade fromScore(int score) {
        for (Grade grade : values()) {
            if (score >= grade.threshold) {
                return grade;
            }
        }
        return F;
    }
}
