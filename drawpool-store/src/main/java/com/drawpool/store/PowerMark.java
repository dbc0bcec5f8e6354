package com.drawpool.store;

/** Direction of a balance change: {@code 0} subtracted, {@code 1} added. */
public enum PowerMark {
    SUB(0),
    ADD(1);

    private final int code;

    PowerMark(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static PowerMark fromCode(int code) {
        return code == 1 ? ADD : SUB;
    }
}
