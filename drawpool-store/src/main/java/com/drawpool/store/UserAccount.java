package com.drawpool.store;

import java.util.Objects;

/** Row of {@code drawpool_users}: the fields the dispatch pool reads. */
public final class UserAccount {

    private final long id;
    private final String username;
    private final long power;

    public UserAccount(long id, String username, long power) {
        this.id = id;
        this.username = username != null ? username : "";
        this.power = power;
    }

    public long getId() {
        return id;
    }

    public String getUsername() {
        return username;
    }

    /** Current credit balance. */
    public long getPower() {
        return power;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UserAccount that = (UserAccount) o;
        return id == that.id && power == that.power && username.equals(that.username);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, username, power);
    }

    @Override
    public String toString() {
        return "UserAccount{id=" + id + ", username=" + username + ", power=" + power + "}";
    }
}
