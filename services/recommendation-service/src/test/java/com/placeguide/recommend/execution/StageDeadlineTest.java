package com.placeguide.recommend.execution;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class StageDeadlineTest {

    @Test
    void zeroBudgetIsExpiredImmediately() {
        assertThat(StageDeadline.after(0).isExpired()).isTrue();
        assertThat(StageDeadline.after(-5).getBudgetMs()).isZero();
    }

    @Test
    void generousBudgetIsNotExpired() {
        StageDeadline deadline = StageDeadline.after(60_000);

        assertThat(deadline.isExpired()).isFalse();
        assertThat(deadline.getBudgetMs()).isEqualTo(60_000);
    }

    @Test
    void unboundedDeadlineNeverExpires() {
        assertThat(StageDeadline.none().isExpired()).isFalse();
    }

    @Test
    void expiresOnceBudgetElapses() throws InterruptedException {
        StageDeadline deadline = StageDeadline.after(20);

        Thread.sleep(60);

        assertThat(deadline.isExpired()).isTrue();
    }
}
