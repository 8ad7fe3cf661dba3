package com.govmatrix.extract.http;

import com.govmatrix.extract.util.ManualTicker;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AdaptiveRateLimiterTest {

    @Test
    void consecutiveDispatchesAreSpacedByCurrentDelay() throws Exception {
        ManualTicker ticker = new ManualTicker(1_000);
        AdaptiveRateLimiter limiter = new AdaptiveRateLimiter(ticker, 600, 2000, 0.98, 1.5);

        long first = limiter.acquire();
        long second = limiter.acquire();
        long third = limiter.acquire();

        assertThat(first).isEqualTo(1_000);
        assertThat(second - first).isEqualTo(600);
        assertThat(third - second).isEqualTo(600);
        assertThat(ticker.nowMillis()).isEqualTo(third);
    }

    @Test
    void tightenWidensSpacingUpToCeiling() throws Exception {
        ManualTicker ticker = new ManualTicker();
        AdaptiveRateLimiter limiter = new AdaptiveRateLimiter(ticker, 600, 2000, 0.98, 1.5);

        limiter.tighten();
        assertThat(limiter.currentDelayMs()).isEqualTo(900);
        long first = limiter.acquire();
        long second = limiter.acquire();
        assertThat(second - first).isEqualTo(900);

        for (int i = 0; i < 10; i++) {
            limiter.tighten();
        }
        assertThat(limiter.currentDelayMs()).isEqualTo(2000);
    }

    @Test
    void relaxNeverGoesBelowFloor() {
        AdaptiveRateLimiter limiter = new AdaptiveRateLimiter(new ManualTicker(), 600, 2000, 0.5, 1.5);
        limiter.tighten();
        limiter.relax();
        limiter.relax();
        assertThat(limiter.currentDelayMs()).isEqualTo(600);
    }

    @Test
    void idleTimeIsNotBanked() throws Exception {
        ManualTicker ticker = new ManualTicker();
        AdaptiveRateLimiter limiter = new AdaptiveRateLimiter(ticker, 600, 2000, 0.98, 1.5);
        limiter.acquire();
        ticker.advance(10_000);

        long afterIdle = limiter.acquire();
        long next = limiter.acquire();

        assertThat(afterIdle).isEqualTo(10_000);
        assertThat(next - afterIdle).isEqualTo(600);
    }
}
