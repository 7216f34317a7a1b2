package com.lpradar.monitor.alert;

public enum CrossDirection {
    ROSE_ABOVE("rose above"),
    FELL_BELOW("fell below");

    private final String text;

    CrossDirection(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }
}
