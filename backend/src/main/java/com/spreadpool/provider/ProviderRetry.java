package com.spreadpool.provider;

import com.spreadpool.config.PoolSettings;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.ExponentialRandomBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

/**
 * Retry template for provider calls: only transient {@link ProviderException}s are retried,
 * with jittered exponential backoff. The default sleeper is interruptible, so cancelling
 * the calling thread ends the wait with a {@code BackOffInterruptedException}.
 */
public final class ProviderRetry {

    private ProviderRetry() {}

    public static RetryTemplate template(PoolSettings settings) {
        return template(settings, new ThreadWaitSleeper());
    }

    public static RetryTemplate template(PoolSettings settings, Sleeper sleeper) {
        ExponentialRandomBackOffPolicy backOff = new ExponentialRandomBackOffPolicy();
        backOff.setInitialInterval(Math.max(1L, settings.getProviderInitialBackoff().toMillis()));
        backOff.setMultiplier(settings.getProviderBackoffMultiplier());
        backOff.setMaxInterval(Math.max(1L, settings.getProviderMaxBackoff().toMillis()));
        backOff.setSleeper(sleeper);

        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new TransientOnlyRetryPolicy(settings.getProviderMaxAttempts()));
        template.setBackOffPolicy(backOff);
        template.setThrowLastExceptionOnExhausted(true);
        return template;
    }

    static class TransientOnlyRetryPolicy extends SimpleRetryPolicy {
        TransientOnlyRetryPolicy(int maxAttempts) {
            super(maxAttempts);
        }

        @Override
        public boolean canRetry(RetryContext context) {
            Throwable t = context.getLastThrowable();
            if (t != null && !(t instanceof ProviderException && ((ProviderException) t).isTransient())) {
                return false;
            }
            return context.getRetryCount() < getMaxAttempts();
        }
    }
}
