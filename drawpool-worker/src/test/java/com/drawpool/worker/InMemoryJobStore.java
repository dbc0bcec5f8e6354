package com.drawpool.worker;

import com.drawpool.store.DrawJob;
import com.drawpool.store.ExpiryResult;
import com.drawpool.store.JobStore;
import com.drawpool.store.PowerLog;
import com.drawpool.store.UserAccount;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/** {@link JobStore} over maps, with the same expiry rules as the JDBC store. */
public class InMemoryJobStore implements JobStore {

    private final Map<Long, DrawJob> jobs = new ConcurrentSkipListMap<>();
    private final Map<Long, UserAccount> users = new ConcurrentSkipListMap<>();
    private final List<PowerLog> powerLogs = new CopyOnWriteArrayList<>();
    private final AtomicLong ids = new AtomicLong();

    public void addUser(long id, String username, long power) {
        users.put(id, new UserAccount(id, username, power));
    }

    public List<PowerLog> getPowerLogs() {
        return new ArrayList<>(powerLogs);
    }

    public int jobCount() {
        return jobs.size();
    }

    @Override
    public long create(DrawJob job) {
        long id = ids.incrementAndGet();
        jobs.put(id, job.toBuilder().id(id).build());
        return id;
    }

    @Override
    public Optional<DrawJob> findById(long id) {
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public List<DrawJob> findUnfinished() {
        return jobs.values().stream().filter(j -> j.getProgress() < DrawJob.PROGRESS_DONE).collect(Collectors.toList());
    }

    @Override
    public List<DrawJob> findPendingArchival() {
        return jobs.values().stream().filter(DrawJob::isPendingArchival).collect(Collectors.toList());
    }

    @Override
    public void update(DrawJob job) {
        jobs.computeIfPresent(job.getId(), (id, old) -> job);
    }

    @Override
    public Optional<UserAccount> findUser(long userId) {
        return Optional.ofNullable(users.get(userId));
    }

    @Override
    public synchronized ExpiryResult expire(DrawJob job, String remark) {
        if (jobs.remove(job.getId()) == null) {
            return ExpiryResult.ALREADY_REMOVED;
        }
        UserAccount user = users.get(job.getUserId());
        if (user == null) {
            return ExpiryResult.REMOVED_WITHOUT_REFUND;
        }
        UserAccount credited = new UserAccount(user.getId(), user.getUsername(), user.getPower() + job.getPower());
        users.put(credited.getId(), credited);
        powerLogs.add(PowerLog.refund(credited, job.getPower(), remark, Instant.now()));
        return ExpiryResult.REFUNDED;
    }
}
