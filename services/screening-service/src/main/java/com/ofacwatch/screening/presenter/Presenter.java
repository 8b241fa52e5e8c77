package com.ofacwatch.screening.presenter;

import com.ofacwatch.screening.domain.AlertRecord;

/**
 * Receives every newly recorded alert. Fire-and-forget: the caller does not wait for delivery.
 */
public interface Presenter {

    void publish(AlertRecord alert);
}
