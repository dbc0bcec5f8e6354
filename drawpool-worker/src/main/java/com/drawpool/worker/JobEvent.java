package com.drawpool.worker;

/** Job state change pushed to the owning client. The constant name is the wire payload. */
public enum JobEvent {
    RUNNING,
    FINISH,
    FAIL
}
