package com.promptsmith.domain.prompt.model;

public enum Complexity {
    LOW, MEDIUM, HIGH
}
