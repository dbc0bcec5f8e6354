package com.drawpool.store;

import java.time.Instant;
import java.util.Objects;

/**
 * Append-only balance change record ({@code drawpool_power_logs}). {@code balance} is the user's
 * balance after the change.
 */
public final class PowerLog {

    /** Model tag written on every drawing-related entry. */
    public static final String MODEL_MID_JOURNEY = "mid-journey";

    private final long userId;
    private final String username;
    private final PowerLogType type;
    private final long amount;
    private final long balance;
    private final PowerMark mark;
    private final String model;
    private final String remark;
    private final Instant createdAt;

    public PowerLog(long userId, String username, PowerLogType type, long amount, long balance,
                    PowerMark mark, String model, String remark, Instant createdAt) {
        this.userId = userId;
        this.username = username != null ? username : "";
        this.type = Objects.requireNonNull(type, "type");
        this.amount = amount;
        this.balance = balance;
        this.mark = Objects.requireNonNull(mark, "mark");
        this.model = model != null ? model : "";
        this.remark = remark != null ? remark : "";
        this.createdAt = createdAt != null ? createdAt : Instant.now();
    }

    /** Refund entry for an expired job, as written by {@link JobStore#expire(DrawJob, String)}. */
    public static PowerLog refund(UserAccount user, long amount, String remark, Instant at) {
        return new PowerLog(user.getId(), user.getUsername(), PowerLogType.REFUND, amount, user.getPower(),
                PowerMark.ADD, MODEL_MID_JOURNEY, remark, at);
    }

    public long getUserId() {
        return userId;
    }

    public String getUsername() {
        return username;
    }

    public PowerLogType getType() {
        return type;
    }

    public long getAmount() {
        return amount;
    }

    public long getBalance() {
        return balance;
    }

    public PowerMark getMark() {
        return mark;
    }

    public String getModel() {
        return model;
    }

    public String getRemark() {
        return remark;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "PowerLog{userId=" + userId + ", type=" + type + ", amount=" + amount + ", balance=" + balance
                + ", mark=" + mark + ", model=" + model + "}";
    }
}
