package com.ofacwatch.screening.presenter;

import com.ofacwatch.screening.domain.AlertRecord;
import com.ofacwatch.screening.domain.MatchLabel;
import com.ofacwatch.screening.support.TestAlerts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AlertFeedPresenter")
class AlertFeedPresenterTest {

    @Test
    @DisplayName("Should return the newest alerts first and drop the oldest beyond capacity")
    void shouldKeepNewestAlerts() {
        AlertFeedPresenter presenter = new AlertFeedPresenter(2);

        presenter.publish(TestAlerts.alert("k1", MatchLabel.MATCH));
        presenter.publish(TestAlerts.alert("k2", MatchLabel.CANDIDATE));
        presenter.publish(TestAlerts.alert("k3", MatchLabel.MATCH));

        assertThat(presenter.recent(10, false)).extracting(AlertRecord::dedupKey).containsExactly("k3", "k2");
        assertThat(presenter.count()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should filter to OFAC matches and honor the limit")
    void shouldFilterMatches() {
        AlertFeedPresenter presenter = new AlertFeedPresenter(10);
        presenter.publish(TestAlerts.alert("k1", MatchLabel.MATCH));
        presenter.publish(TestAlerts.alert("k2", MatchLabel.CANDIDATE));
        presenter.publish(TestAlerts.alert("k3", MatchLabel.MATCH));

        assertThat(presenter.recent(10, true)).extracting(AlertRecord::dedupKey).containsExactly("k3", "k1");
        assertThat(presenter.recent(1, false)).extracting(AlertRecord::dedupKey).containsExactly("k3");
    }

    @Test
    @DisplayName("Should reject a non-positive capacity")
    void shouldRejectInvalidCapacity() {
        assertThatThrownBy(() -> new AlertFeedPresenter(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
