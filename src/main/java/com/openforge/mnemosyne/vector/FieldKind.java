package com.openforge.mnemosyne.vector;

public enum FieldKind {
    INT64,
    FLOAT,
    VARCHAR,
    FLOAT_VECTOR;

    public boolean isVector() {
        return this == FLOAT_VECTOR;
    }
}
