package com.householdledger.recurring.model;

public enum Frequency {
    MONTHLY("Monthly"),
    YEARLY("Yearly");

    private final String label;

    Frequency(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
