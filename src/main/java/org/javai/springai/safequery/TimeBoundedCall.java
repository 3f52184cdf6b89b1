package org.javai.springai.safequery;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs a blocking call on a worker thread and waits for it for a bounded time.
 *
 * <p>On timeout or interruption of the waiting thread the worker is cancelled
 * (interrupted) and the call counts as failed. Workers are daemon threads.</p>
 */
final class TimeBoundedCall implements AutoCloseable {

	private final ExecutorService executor;

	TimeBoundedCall() {
		this.executor = Executors.newCachedThreadPool(new DaemonThreadFactory());
	}

	/**
	 * @throws TimeoutException when the call did not finish in time
	 * @throws InterruptedException when the calling thread was interrupted while waiting
	 */
	<T> T call(Supplier<T> task, Duration timeout) throws TimeoutException, InterruptedException {
		Objects.requireNonNull(task, "task must not be null");
		Objects.requireNonNull(timeout, "timeout must not be null");
		if (Thread.currentThread().isInterrupted()) {
			throw new InterruptedException("interrupted before call");
		}
		Future<T> future = executor.submit(task::get);
		try {
			return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
		} catch (TimeoutException | InterruptedException e) {
			future.cancel(true);
			throw e;
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException runtime) {
				throw runtime;
			}
			if (cause instanceof Error error) {
				throw error;
			}
			throw new IllegalStateException(cause);
		}
	}

	@Override
	public void close() {
		executor.shutdownNow();
	}

	private static final class DaemonThreadFactory implements ThreadFactory {

		private final AtomicInteger counter = new AtomicInteger();

		@Override
		public Thread newThread(Runnable runnable) {
			Thread thread = new Thread(runnable, "safequery-call-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		}
	}
}
