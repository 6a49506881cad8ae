package com.intteq.broker.rpc.tasks;

import java.util.Arrays;
import java.util.Optional;

public enum TaskPriority {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String wireValue;

    TaskPriority(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static Optional<TaskPriority> fromWire(String value) {
        return Arrays.stream(values()).filter(p -> p.wireValue.equals(value)).findFirst();
    }
}
