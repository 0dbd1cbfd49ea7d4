package org.codelibs.rcmd.model;

public enum ModelType {
    PAIRWISE("pairwise"), ITEMSET("itemset");

    private final String value;

    ModelType(final String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
