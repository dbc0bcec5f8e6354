package com.drawpool.store;

/** Reason code stored in {@code drawpool_power_logs.type}. */
public enum PowerLogType {
    RECHARGE(1),
    CONSUME(2),
    REFUND(3),
    INVITE(4),
    REWARD(5);

    private final int code;

    PowerLogType(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static PowerLogType fromCode(int code) {
        for (PowerLogType t : values()) {
            if (t.code == code) return t;
        }
        throw new IllegalArgumentException("Unknown power log type: " + code);
    }
}
