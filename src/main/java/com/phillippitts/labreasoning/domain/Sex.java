package com.phillippitts.labreasoning.domain;

public enum Sex {
    MALE,
    FEMALE
}
