package com.ofacwatch.screening.presenter;

import com.ofacwatch.screening.domain.AlertRecord;
import com.ofacwatch.screening.domain.MatchLabel;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Keeps the most recent alerts for the monitor API and writes one log line per alert.
 *
 * <p>Capacity is bounded; the oldest alert is dropped first.</p>
 */
@Slf4j
public class AlertFeedPresenter implements Presenter {

    private final int capacity;
    private final Deque<AlertRecord> feed = new ArrayDeque<>();
    private long published;

    public AlertFeedPresenter(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    @Override
    public void publish(AlertRecord alert) {
        synchronized (feed) {
            feed.addFirst(alert);
            while (feed.size() > capacity) {
                feed.removeLast();
            }
            published++;
        }
        log.info("[{}] {} -> {} ({}) score={} source={} url={}",
                alert.match().label().getDisplayName(),
                alert.mention().rawText(),
                alert.match().entityName(),
                alert.match().entityId(),
                String.format("%.3f", alert.match().score()),
                alert.mention().sourceId(),
                alert.mention().url());
    }

    /**
     * Most recent alerts first.
     *
     * @param onlyMatches keep only {@link MatchLabel#MATCH} alerts
     */
    public List<AlertRecord> recent(int limit, boolean onlyMatches) {
        List<AlertRecord> result = new ArrayList<>();
        synchronized (feed) {
            Iterator<AlertRecord> it = feed.iterator();
            while (it.hasNext() && result.size() < limit) {
                AlertRecord alert = it.next();
                if (!onlyMatches || alert.match().label() == MatchLabel.MATCH) {
                    result.add(alert);
                }
            }
        }
        return result;
    }

    /**
     * Alerts published since startup, including those no longer held in the feed.
     */
    public long count() {
        synchronized (feed) {
            return published;
        }
    }

    public int capacity() {
        return capacity;
    }
}
